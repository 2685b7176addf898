package com.wildfire.resolution.core.model;

/**
 * How recent a risk observation is.
 */
public enum Freshness {
    LIVE,
    CACHED,
    SYNTHETIC
}
