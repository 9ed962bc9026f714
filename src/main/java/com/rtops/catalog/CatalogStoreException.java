package com.rtops.catalog;

/**
 * Exception thrown when the catalog store cannot be read or written.
 * Fatal for the import pass that hits it.
 */
public class CatalogStoreException extends RuntimeException {
    
    public CatalogStoreException(String message) {
        super(message);
    }
    
    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
