package com.orderline.resolution.catalog;

/**
 * Thrown when a catalog source cannot be read or parsed.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
