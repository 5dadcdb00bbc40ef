package com.cgi.fielddiscovery.common.exception;

/**
 * Exception for discovery store write or read failures.
 */
public class PersistenceException extends BaseException {
    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message, "PERSISTENCE_ERROR");
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause, "PERSISTENCE_ERROR");
    }
}
