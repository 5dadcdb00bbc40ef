package com.cgi.fielddiscovery.common.exception;

/**
 * Exception for errors while rendering an export of discovered fields.
 */
public class ExportException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ExportException(String message) {
        super(message, "EXPORT_ERROR");
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause, "EXPORT_ERROR");
    }
}
