package com.wildfire.resolution.geo;

import java.util.regex.Pattern;

/**
 * Base32 geohash encoding used to key the risk cache.
 *
 * <p>Encoding is deterministic: the same coordinate and precision always produce the same string.
 * At the default precision of 5 a cell spans roughly 4.9km x 4.9km, so nearby queries share a key.
 * Keys are only used for cache lookups, never for proximity search.</p>
 */
public final class Geohash {

    public static final int DEFAULT_PRECISION = 5;
    public static final int MAX_PRECISION = 12;

    private static final String BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz";
    private static final Pattern VALID = Pattern.compile("^[0-9bcdefghjkmnpqrstuvwxyz]+$");

    private Geohash() {
    }

    /**
     * Encodes a coordinate at the default cache precision.
     */
    public static String encode(double latitude, double longitude) {
        return encode(latitude, longitude, DEFAULT_PRECISION);
    }

    /**
     * Encodes a coordinate at the given precision.
     *
     * @throws IllegalArgumentException if the precision is outside 1..12 or the coordinate is out of range
     */
    public static String encode(double latitude, double longitude, int precision) {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                    "Geohash precision must be between 1 and " + MAX_PRECISION + ", got: " + precision);
        }
        if (!(latitude >= -90.0 && latitude <= 90.0) || !(longitude >= -180.0 && longitude <= 180.0)) {
            throw new IllegalArgumentException("Coordinate out of range for geohash");
        }

        double latMin = -90.0;
        double latMax = 90.0;
        double lonMin = -180.0;
        double lonMax = 180.0;

        StringBuilder hash = new StringBuilder(precision);
        int bits = 0;
        int bitCount = 0;
        boolean evenBit = true;

        while (hash.length() < precision) {
            if (evenBit) {
                double mid = (lonMin + lonMax) / 2;
                if (longitude >= mid) {
                    bits = (bits << 1) | 1;
                    lonMin = mid;
                } else {
                    bits = bits << 1;
                    lonMax = mid;
                }
            } else {
                double mid = (latMin + latMax) / 2;
                if (latitude >= mid) {
                    bits = (bits << 1) | 1;
                    latMin = mid;
                } else {
                    bits = bits << 1;
                    latMax = mid;
                }
            }
            evenBit = !evenBit;

            if (++bitCount == 5) {
                hash.append(BASE32.charAt(bits));
                bits = 0;
                bitCount = 0;
            }
        }
        return hash.toString();
    }

    /**
     * Returns the bounding box of a geohash cell.
     *
     * @throws IllegalArgumentException if the hash is not a valid geohash
     */
    public static GeoBounds decodeBounds(String geohash) {
        if (!isValid(geohash)) {
            throw new IllegalArgumentException("Invalid geohash: " + geohash);
        }
        double latMin = -90.0;
        double latMax = 90.0;
        double lonMin = -180.0;
        double lonMax = 180.0;
        boolean evenBit = true;

        for (int i = 0; i < geohash.length(); i++) {
            int value = BASE32.indexOf(geohash.charAt(i));
            for (int bit = 4; bit >= 0; bit--) {
                boolean set = ((value >> bit) & 1) == 1;
                if (evenBit) {
                    double mid = (lonMin + lonMax) / 2;
                    if (set) {
                        lonMin = mid;
                    } else {
                        lonMax = mid;
                    }
                } else {
                    double mid = (latMin + latMax) / 2;
                    if (set) {
                        latMin = mid;
                    } else {
                        latMax = mid;
                    }
                }
                evenBit = !evenBit;
            }
        }
        return new GeoBounds(latMin, lonMin, latMax, lonMax);
    }

    public static boolean isValid(String geohash) {
        return geohash != null
                && !geohash.isEmpty()
                && geohash.length() <= MAX_PRECISION
                && VALID.matcher(geohash).matches();
    }
}
