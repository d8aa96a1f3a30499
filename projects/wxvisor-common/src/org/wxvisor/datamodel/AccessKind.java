package org.wxvisor.datamodel;

import org.wxvisor.common.ConfigurationException;

public enum AccessKind {
    READ,
    WRITE,
    EXECUTE;

    public static AccessKind fromName(String name) {
        for (AccessKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new ConfigurationException("Unknown access kind: " + name);
    }

    public String label() {
        return name().toLowerCase();
    }
}
