package com.qqsuccubus.telemetry.core.error;

import lombok.Getter;

/**
 * The transport refused a subscribe or unsubscribe call.
 */
@Getter
public class SubscriptionException extends TelemetryException {
    private final String topic;

    public SubscriptionException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }
}
