package com.wildfire.resolution.cache;

import java.util.Optional;
import java.util.Set;

/**
 * String key-value storage underneath the {@link Geocache}.
 * Implementations must be thread-safe.
 */
public interface CacheStore {

    Optional<String> get(String key) throws CacheStoreException;

    void put(String key, String value) throws CacheStoreException;

    /**
     * Removes a key. Removing a missing key is not an error.
     */
    void remove(String key) throws CacheStoreException;

    Set<String> keys() throws CacheStoreException;
}
