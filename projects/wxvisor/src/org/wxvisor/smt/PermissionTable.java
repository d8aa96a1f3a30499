package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.FuncDecl;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.datamodel.AccessKind;
import org.wxvisor.datamodel.AddressKind;

/**
 * <p>The permission attributes of one page table, as two uninterpreted
 * functions {@code name_ro} and {@code name_nx} from address to bit.</p>
 *
 * <p>Bits that are never pinned stay free, so a query ranges over every
 * page table consistent with the pinned entries.</p>
 */
public class PermissionTable {

    private Encoder _enc;

    private String _name;

    private AddressKind _kind;

    private FuncDecl<BoolSort> _ro;

    private FuncDecl<BoolSort> _nx;

    PermissionTable(Encoder enc, String name, AddressKind kind, FuncDecl<BoolSort> ro,
            FuncDecl<BoolSort> nx) {
        _enc = enc;
        _name = name;
        _kind = kind;
        _ro = ro;
        _nx = nx;
    }

    public BoolExpr getBit(PermissionBit bit, SymbolicAddress a) {
        if (a.getKind() != _kind) {
            throw new WxvisorException(_name + " holds " + _kind + " permissions, not " + a);
        }
        FuncDecl<BoolSort> f = (bit == PermissionBit.RO ? _ro : _nx);
        return (BoolExpr) _enc.getCtx().mkApp(f, a.getExpr());
    }

    public BoolExpr ro(SymbolicAddress a) {
        return getBit(PermissionBit.RO, a);
    }

    public BoolExpr nx(SymbolicAddress a) {
        return getBit(PermissionBit.NX, a);
    }

    public void assertPermission(PermissionBit bit, SymbolicAddress a, boolean value) {
        BoolExpr b = getBit(bit, a);
        _enc.add(label(bit, a) + " = " + value, value ? b : _enc.Not(b));
    }

    /**
     * Whether this table alone lets the access through: reads always,
     * writes when {@code ro} is clear, execution when {@code nx} is clear.
     */
    public BoolExpr grants(SymbolicAddress a, AccessKind kind) {
        PermissionBit bit = PermissionBit.governing(kind);
        if (bit == null) {
            return _enc.True();
        }
        return _enc.Not(getBit(bit, a));
    }

    public void observe(SymbolicAddress a) {
        for (PermissionBit bit : PermissionBit.values()) {
            _enc.observe(label(bit, a), getBit(bit, a));
        }
    }

    String label(PermissionBit bit, SymbolicAddress a) {
        return _name + "_" + bit.getSuffix() + "(" + a.getName() + ")";
    }

    public String getName() {
        return _name;
    }

    public AddressKind getKind() {
        return _kind;
    }
}
