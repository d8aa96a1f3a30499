package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.AddressKind;
import org.wxvisor.datamodel.WxPolicy;

/**
 * <p>The permissions physical frames actually exhibit ({@code phy_ro} and
 * {@code phy_nx}). Binding a mapping to its frame equates the frame bit with
 * the composed bit of the mapping, so every alias that reaches the same
 * frame is held to the same effective permission.</p>
 */
public class PhysicalMemory {

    public static final String TABLE_NAME = "phy";

    private Encoder _enc;

    private PermissionTable _frames;

    public PhysicalMemory(Encoder enc) {
        _enc = enc;
        _frames = enc.declarePermissionTable(TABLE_NAME, AddressKind.PA);
    }

    public void bind(ComposedPermission composed, SymbolicAddress va) {
        SymbolicAddress pa = composed.translate(va);
        if (pa.getKind() != AddressKind.PA) {
            throw new WxvisorException(va + " does not translate to a physical address");
        }
        for (PermissionBit bit : PermissionBit.values()) {
            _enc.add("frame " + _frames.label(bit, pa) + " of " + va.getName(),
                    _enc.Eq(_frames.getBit(bit, pa), composed.bitSet(bit, va)));
        }
    }

    public BoolExpr grants(SymbolicAddress pa, AccessKind kind) {
        return _frames.grants(pa, kind);
    }

    public void assertWxPolicy(SymbolicAddress pa, WxPolicy policy) {
        _enc.add("W^X on " + pa.getName(), ComposedPermission.wxPolicy(_enc,
                grants(pa, AccessKind.WRITE), grants(pa, AccessKind.EXECUTE), policy));
    }

    public PermissionTable getFrames() {
        return _frames;
    }
}
