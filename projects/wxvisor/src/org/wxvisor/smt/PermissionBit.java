package org.wxvisor.smt;

import org.wxvisor.datamodel.AccessKind;

/**
 * The page-table bits that can deny an access.
 */
public enum PermissionBit {

    /** Read-only: denies writes. */
    RO("ro"),

    /** Non-execute: denies instruction fetches. */
    NX("nx");

    private final String _suffix;

    PermissionBit(String suffix) {
        _suffix = suffix;
    }

    public String getSuffix() {
        return _suffix;
    }

    /**
     * The bit that decides the given kind of access, or null for reads,
     * which every valid mapping grants.
     */
    public static PermissionBit governing(AccessKind kind) {
        switch (kind) {
            case WRITE:
                return RO;
            case EXECUTE:
                return NX;
            default:
                return null;
        }
    }
}
