package com.wildfire.resolution.error;

/**
 * Finer-grained reason attached to a {@link ServiceError}, mainly used by location resolution
 * so callers can tell "no location, ask the user" apart from other validation failures.
 */
public enum ErrorKind {
    UNSPECIFIED,
    PERMISSION_DENIED,
    LOCATION_UNAVAILABLE,
    TIMEOUT,
    INVALID_INPUT
}
