package com.cgi.fielddiscovery.common.exception;

/**
 * Exception for rejected client input.
 */
public class ValidationException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message, "INVALID_ARGUMENT");
    }
}
