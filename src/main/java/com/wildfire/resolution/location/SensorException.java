package com.wildfire.resolution.location;

/**
 * Thrown by a {@link PositionSensor} when a fix cannot be obtained.
 */
public class SensorException extends Exception {

    public enum Reason { PERMISSION_DENIED, SERVICE_DISABLED, TIMEOUT, HARDWARE }

    private final Reason reason;

    public SensorException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SensorException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
