package org.wxvisor.common;

/**
 * The satisfiability oracle could not be loaded or initialized.
 */
public class OracleUnavailableException extends WxvisorException {

    private static final long serialVersionUID = 1L;

    public OracleUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
