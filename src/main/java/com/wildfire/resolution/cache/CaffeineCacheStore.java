package com.wildfire.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * In-process {@link CacheStore} backed by a bounded Caffeine cache.
 * Expiry and LRU are owned by the {@link Geocache}; the Caffeine bound is only a safety ceiling.
 */
public class CaffeineCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCacheStore.class);

    private final Cache<String, String> cache;

    public CaffeineCacheStore(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
        log.debug("CaffeineCacheStore initialized: maximumSize={}", maximumSize);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, String value) {
        cache.put(key, value);
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(cache.asMap().keySet());
    }
}
