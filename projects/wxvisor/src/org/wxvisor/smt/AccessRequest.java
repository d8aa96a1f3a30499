package org.wxvisor.smt;

import org.wxvisor.datamodel.AccessKind;

public class AccessRequest {

    private final SymbolicAddress _address;

    private final AccessKind _kind;

    public AccessRequest(SymbolicAddress address, AccessKind kind) {
        _address = address;
        _kind = kind;
    }

    public SymbolicAddress getAddress() {
        return _address;
    }

    public AccessKind getKind() {
        return _kind;
    }

    @Override
    public String toString() {
        return _kind.label() + "(" + _address.getName() + ")";
    }
}
