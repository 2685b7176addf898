package com.wildfire.resolution.fetch;

/**
 * Thrown when an upstream response body cannot be parsed. Never retried.
 */
public class ResponseParseException extends Exception {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
