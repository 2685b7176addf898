package com.wildfire.resolution.location;

import java.util.Optional;

/**
 * Small persisted key-value store for user preferences.
 * A value stored with one type reads as absent through the getters of another type.
 */
public interface PreferenceStore {

    Optional<String> getString(String key);

    Optional<Double> getDouble(String key);

    Optional<Long> getLong(String key);

    void putString(String key, String value);

    void putDouble(String key, double value);

    void putLong(String key, long value);

    void remove(String key);
}
