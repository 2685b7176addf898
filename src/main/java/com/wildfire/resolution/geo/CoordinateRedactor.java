package com.wildfire.resolution.geo;

import com.wildfire.resolution.core.model.GeoCoordinate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formats coordinates for logs. Every log statement that mentions a coordinate goes through
 * this class; values are rounded to two decimal places (about 1.1km).
 */
public final class CoordinateRedactor {

    static final String INVALID = "INVALID_COORDS";

    private CoordinateRedactor() {
    }

    /**
     * Returns {@code "lat,lon"} rounded half-up to 2 decimal places, e.g. {@code "55.95,-3.19"}.
     */
    public static String redact(double latitude, double longitude) {
        if (!GeoCoordinate.isValid(latitude, longitude)) {
            return INVALID;
        }
        return round(latitude) + "," + round(longitude);
    }

    public static String redact(GeoCoordinate coordinate) {
        if (coordinate == null) {
            return INVALID;
        }
        return redact(coordinate.latitude(), coordinate.longitude());
    }

    private static String round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
