package com.wildfire.resolution.fetch;

/**
 * A single network attempt wrapped by the {@link ResilientFetcher}.
 *
 * <p>Implementations signal failures by throwing: {@link HttpStatusException} for non-2xx responses,
 * {@link java.io.IOException} for transport faults, {@link ResponseParseException} for bodies that
 * cannot be understood. Anything else is treated as a terminal general failure.</p>
 *
 * @param <T> the value produced by a successful attempt
 */
@FunctionalInterface
public interface FetchOperation<T> {

    T execute() throws Exception;
}
