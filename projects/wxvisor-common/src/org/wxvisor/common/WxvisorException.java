package org.wxvisor.common;

/**
 * Thrown by wxvisor for any failure that is not a solver verdict.
 */
public class WxvisorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public WxvisorException(String msg) {
        super(msg);
    }

    public WxvisorException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
