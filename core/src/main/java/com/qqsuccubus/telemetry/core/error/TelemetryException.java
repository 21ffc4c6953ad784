package com.qqsuccubus.telemetry.core.error;

/**
 * Base class for errors the telemetry state engine reports to its callers.
 */
public class TelemetryException extends RuntimeException {
    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
