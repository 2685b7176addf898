package com.wildfire.resolution.location;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, process-local {@link PreferenceStore}.
 */
public class InMemoryPreferenceStore implements PreferenceStore {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> getString(String key) {
        return typed(key, String.class);
    }

    @Override
    public Optional<Double> getDouble(String key) {
        return typed(key, Double.class);
    }

    @Override
    public Optional<Long> getLong(String key) {
        return typed(key, Long.class);
    }

    @Override
    public void putString(String key, String value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public void putDouble(String key, double value) {
        values.put(key, value);
    }

    @Override
    public void putLong(String key, long value) {
        values.put(key, value);
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    private <T> Optional<T> typed(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
