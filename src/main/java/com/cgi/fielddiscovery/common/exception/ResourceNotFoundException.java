package com.cgi.fielddiscovery.common.exception;

/**
 * Exception thrown when a session or field cannot be found.
 */
public class ResourceNotFoundException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id, "NOT_FOUND");
    }
}
