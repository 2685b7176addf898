package com.wildfire.resolution.core.model;

/**
 * Six ordered wildfire risk tiers, lowest first.
 */
public enum RiskLevel {
    VERY_LOW,
    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH,
    EXTREME;

    /**
     * Maps a Fire Weather Index value to a risk tier.
     * <ul>
     *   <li>&lt; 5 : very low</li>
     *   <li>5 to &lt; 12 : low</li>
     *   <li>12 to &lt; 21 : moderate</li>
     *   <li>21 to &lt; 38 : high</li>
     *   <li>38 to &lt; 50 : very high</li>
     *   <li>&ge; 50 : extreme</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the value is negative or not finite
     */
    public static RiskLevel fromIndex(double indexValue) {
        if (!Double.isFinite(indexValue) || indexValue < 0.0) {
            throw new IllegalArgumentException("Index value must be a non-negative number: " + indexValue);
        }
        if (indexValue < 5.0) {
            return VERY_LOW;
        } else if (indexValue < 12.0) {
            return LOW;
        } else if (indexValue < 21.0) {
            return MODERATE;
        } else if (indexValue < 38.0) {
            return HIGH;
        } else if (indexValue < 50.0) {
            return VERY_HIGH;
        }
        return EXTREME;
    }
}
