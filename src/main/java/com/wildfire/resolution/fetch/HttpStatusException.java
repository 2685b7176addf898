package com.wildfire.resolution.fetch;

/**
 * Thrown by a fetch operation when the upstream answered with a non-2xx status.
 */
public class HttpStatusException extends Exception {

    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode <= 599;
    }
}
