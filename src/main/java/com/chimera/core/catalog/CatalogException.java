package com.chimera.core.catalog;

/**
 * Raised when ability or adversary definitions cannot be loaded or are inconsistent.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
