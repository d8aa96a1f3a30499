package org.wxvisor.smt;

import com.microsoft.z3.BitVecExpr;
import org.wxvisor.datamodel.AddressKind;

/**
 * A symbolic address together with the address space it lives in and a
 * readable name such as {@code va} or {@code mmu1(va)}.
 */
public class SymbolicAddress {

    private final AddressKind _kind;

    private final String _name;

    private final BitVecExpr _expr;

    public SymbolicAddress(AddressKind kind, String name, BitVecExpr expr) {
        _kind = kind;
        _name = name;
        _expr = expr;
    }

    public AddressKind getKind() {
        return _kind;
    }

    public String getName() {
        return _name;
    }

    public BitVecExpr getExpr() {
        return _expr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        SymbolicAddress that = (SymbolicAddress) o;

        if (_kind != that._kind) return false;
        return _expr.equals(that._expr);
    }

    @Override
    public int hashCode() {
        int result = _kind.hashCode();
        result = 31 * result + _expr.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return _kind + ":" + _name;
    }
}
