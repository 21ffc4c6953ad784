package com.qqsuccubus.telemetry.core.error;

/**
 * Save was requested while the live time buffer holds no samples.
 */
public class EmptyRecordingException extends TelemetryException {
    public EmptyRecordingException(String message) {
        super(message);
    }
}
