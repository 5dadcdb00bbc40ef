package com.cgi.fielddiscovery.common.exception;

/**
 * Exception for operations that are not allowed in the current state of a resource,
 * e.g. deleting a session that is still running.
 */
public class InvalidStateException extends BaseException {
    private static final long serialVersionUID = 1L;

    public InvalidStateException(String message) {
        super(message, "INVALID_STATE");
    }
}
