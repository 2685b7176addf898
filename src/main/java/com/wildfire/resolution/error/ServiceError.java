package com.wildfire.resolution.error;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Structured error returned (never thrown) by every boundary operation.
 *
 * @param category   error classification
 * @param message    human-readable description, never empty
 * @param statusCode HTTP-like status code, or {@code null} for non-transport errors
 * @param kind       finer-grained reason, {@link ErrorKind#UNSPECIFIED} when not applicable
 */
public record ServiceError(ErrorCategory category, String message, Integer statusCode, ErrorKind kind) {

    public ServiceError {
        Objects.requireNonNull(category, "category is required");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be empty");
        }
        kind = kind != null ? kind : ErrorKind.UNSPECIFIED;
    }

    public static ServiceError of(ErrorCategory category, String message) {
        return new ServiceError(category, message, null, ErrorKind.UNSPECIFIED);
    }

    public static ServiceError validation(String message) {
        return new ServiceError(ErrorCategory.VALIDATION, message, null, ErrorKind.INVALID_INPUT);
    }

    public static ServiceError validation(String message, ErrorKind kind) {
        return new ServiceError(ErrorCategory.VALIDATION, message, null, kind);
    }

    /**
     * Creates an error for an HTTP status using the fixed status-to-category mapping.
     */
    public static ServiceError fromStatus(int statusCode, String message) {
        return new ServiceError(ErrorCategory.fromStatus(statusCode), message, statusCode, ErrorKind.UNSPECIFIED);
    }

    public static ServiceError network(String message) {
        return new ServiceError(ErrorCategory.NETWORK, message, null, ErrorKind.UNSPECIFIED);
    }

    public static ServiceError parse(String message) {
        return new ServiceError(ErrorCategory.PARSE, message, null, ErrorKind.UNSPECIFIED);
    }

    public static ServiceError general(String message) {
        return new ServiceError(ErrorCategory.GENERAL, message, null, ErrorKind.UNSPECIFIED);
    }

    public OptionalInt status() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ServiceError(").append(category);
        if (statusCode != null) {
            sb.append(", ").append(statusCode);
        }
        if (kind != ErrorKind.UNSPECIFIED) {
            sb.append(", ").append(kind);
        }
        return sb.append("): ").append(message).toString();
    }
}
