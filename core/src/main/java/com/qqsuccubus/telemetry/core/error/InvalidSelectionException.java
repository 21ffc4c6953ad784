package com.qqsuccubus.telemetry.core.error;

/**
 * A channel selection would leave a selected sensor without any active metric, or refers to a
 * sensor that is not selected. The previous selection is retained.
 */
public class InvalidSelectionException extends TelemetryException {
    public InvalidSelectionException(String message) {
        super(message);
    }
}
