package com.wildfire.resolution.core.model;

/**
 * Origin of a risk observation. A cache hit keeps the source of the original observation,
 * so {@link #CACHE} only appears when a stored record was written with it.
 */
public enum RiskSource {
    /**
     * Global primary index provider.
     */
    PRIMARY,

    /**
     * Region-specific provider, only consulted inside its bounding region.
     */
    SECONDARY,

    CACHE,

    /**
     * Deterministic generator used when every other stage failed.
     */
    SYNTHETIC
}
