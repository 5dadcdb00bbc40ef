package com.cgi.fielddiscovery.common.exception;

/**
 * Exception for failures talking to the catalog/asset service.
 */
public class CatalogException extends BaseException {
    private static final long serialVersionUID = 1L;

    public CatalogException(String message) {
        super(message, "CATALOG_ERROR");
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause, "CATALOG_ERROR");
    }
}
