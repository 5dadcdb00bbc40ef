package com.cgi.fielddiscovery.common.exception;

/**
 * Exception raised when the AI classification provider fails or answers with an unusable payload.
 */
public class ClassificationException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ClassificationException(String message) {
        super(message, "CLASSIFICATION_ERROR");
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause, "CLASSIFICATION_ERROR");
    }
}
