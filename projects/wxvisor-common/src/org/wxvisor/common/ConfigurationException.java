package org.wxvisor.common;

/**
 * An invalid address width, stage count, scenario or question parameter.
 * Always raised before any constraint reaches the solver.
 */
public class ConfigurationException extends WxvisorException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String msg) {
        super(msg);
    }

    public ConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
