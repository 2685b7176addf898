package com.wildfire.resolution.cache;

/**
 * Thrown when the underlying cache store cannot be read or written.
 */
public class CacheStoreException extends Exception {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
