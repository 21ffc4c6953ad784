package com.qqsuccubus.telemetry.station.mqtt;

import com.qqsuccubus.telemetry.core.error.SubscriptionException;

/**
 * Publish/subscribe transport used by the station (Dependency Inversion Principle).
 * <p>
 * Subscribe and unsubscribe are fire-and-forget: an immediate refusal is thrown as
 * {@link SubscriptionException}, a later broker-side failure is only logged by the implementation.
 * Delivery is at-least-once per subscription.
 * </p>
 */
public interface ITelemetryTransport {

    /**
     * Callback for inbound messages, invoked on the transport's delivery thread.
     */
    @FunctionalInterface
    interface MessageListener {
        void onMessage(String topic, byte[] payload);
    }

    /**
     * Connects and keeps reconnecting until {@link #disconnect()}.
     *
     * @param listener    Receives every inbound message
     * @param onConnected Invoked after each successful (re)connect, e.g. to restore subscriptions
     */
    void connect(MessageListener listener, Runnable onConnected);

    void subscribe(String topic);

    void unsubscribe(String topic);

    boolean isConnected();

    void disconnect();
}
