package com.wildfire.resolution.error;

/**
 * Classification of every failure that can cross a component boundary.
 *
 * <ul>
 *   <li>{@link #VALIDATION}: bad input, caller's fault, surfaced immediately</li>
 *   <li>{@link #NOT_FOUND}, {@link #SERVICE_UNAVAILABLE}, {@link #GENERAL}: source-classified
 *       transport failures, recovered internally by falling back</li>
 *   <li>{@link #NETWORK}: connectivity faults and timeouts</li>
 *   <li>{@link #PARSE}: a successful transport response with unusable content, never retried</li>
 * </ul>
 */
public enum ErrorCategory {
    VALIDATION,
    NOT_FOUND,
    SERVICE_UNAVAILABLE,
    NETWORK,
    PARSE,
    GENERAL;

    /**
     * Maps a non-2xx HTTP status code to a category.
     * 404 is {@link #NOT_FOUND}, 503 is {@link #SERVICE_UNAVAILABLE}, everything else is {@link #GENERAL}.
     */
    public static ErrorCategory fromStatus(int statusCode) {
        return switch (statusCode) {
            case 404 -> NOT_FOUND;
            case 503 -> SERVICE_UNAVAILABLE;
            default -> GENERAL;
        };
    }
}
