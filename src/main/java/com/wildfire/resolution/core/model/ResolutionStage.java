package com.wildfire.resolution.core.model;

/**
 * Stages of the risk fallback chain, in the order they are attempted.
 */
public enum ResolutionStage {
    PRIMARY("Primary"),
    SECONDARY("Secondary"),
    CACHE("Cache"),
    SYNTHETIC("Synthetic");

    private final String displayName;

    ResolutionStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
