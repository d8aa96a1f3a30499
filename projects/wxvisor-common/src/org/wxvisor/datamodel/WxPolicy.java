package org.wxvisor.datamodel;

import org.wxvisor.common.ConfigurationException;

/**
 * How the write-xor-execute rule constrains a single page.
 */
public enum WxPolicy {

    /** A page is never writable and executable at once. */
    EXCLUSIVE,

    /** A page is in exactly one of the writable or the executable state. */
    TOGGLE;

    public static WxPolicy fromName(String name) {
        for (WxPolicy p : values()) {
            if (p.name().equalsIgnoreCase(name)) {
                return p;
            }
        }
        throw new ConfigurationException("Unknown W^X policy: " + name);
    }
}
