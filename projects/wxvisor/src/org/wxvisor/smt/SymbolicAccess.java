package org.wxvisor.smt;

import com.microsoft.z3.BoolExpr;
import org.wxvisor.datamodel.AccessKind;

import java.util.Arrays;

/**
 * <p>An access to a virtual address whose kind is left to the solver.
 * The {@code granted} flag is tied to the composed grant of whichever kind
 * the solver picks:</p>
 *
 * <pre>
 * granted == OR_k (kind == k AND effective(va, k))
 * </pre>
 */
public class SymbolicAccess {

    private Encoder _enc;

    private SymbolicAddress _address;

    private SymbolicEnum<AccessKind> _kind;

    private BoolExpr _granted;

    public SymbolicAccess(Encoder enc, ComposedPermission composed, SymbolicAddress va,
            String name) {
        _enc = enc;
        _address = va;
        _kind = new SymbolicEnum<>(enc, name + "_kind", Arrays.asList(AccessKind.values()));
        _granted = enc.mkBool(name + "_granted");

        BoolExpr[] cases = new BoolExpr[AccessKind.values().length];
        int i = 0;
        for (AccessKind k : AccessKind.values()) {
            cases[i++] = enc.And(_kind.is(k), composed.granted(va, k));
        }
        enc.add(name + " granted on " + va.getName(), enc.Eq(_granted, enc.Or(cases)));
        enc.observe(name + "_kind", _kind);
    }

    public BoolExpr isKind(AccessKind kind) {
        return _kind.is(kind);
    }

    public BoolExpr getGranted() {
        return _granted;
    }

    public SymbolicAddress getAddress() {
        return _address;
    }
}
