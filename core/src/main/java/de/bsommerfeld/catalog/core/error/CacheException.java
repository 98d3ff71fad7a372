package de.bsommerfeld.catalog.core.error;

/**
 * Cache storage or build failure.
 */
public class CacheException extends CatalogException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
