package com.qqsuccubus.telemetry.station.support;

import com.qqsuccubus.telemetry.core.error.SubscriptionException;
import com.qqsuccubus.telemetry.station.mqtt.ITelemetryTransport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory transport that records calls and can refuse chosen topics.
 */
public class RecordingTransport implements ITelemetryTransport {
    public final List<String> subscribed = new ArrayList<>();
    public final List<String> unsubscribed = new ArrayList<>();
    public final Set<String> refuse = new HashSet<>();

    private MessageListener listener;
    private Runnable onConnected;
    private boolean connected;

    @Override
    public void connect(MessageListener listener, Runnable onConnected) {
        this.listener = listener;
        this.onConnected = onConnected;
        reconnect();
    }

    /**
     * Simulates a (re)connect, running the registered callback.
     */
    public void reconnect() {
        connected = true;
        if (onConnected != null) {
            onConnected.run();
        }
    }

    public void deliver(String topic, String payload) {
        listener.onMessage(topic, payload.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void subscribe(String topic) {
        if (refuse.contains(topic)) {
            throw new SubscriptionException(topic, "refused " + topic, null);
        }
        subscribed.add(topic);
    }

    @Override
    public void unsubscribe(String topic) {
        if (refuse.contains(topic)) {
            throw new SubscriptionException(topic, "refused " + topic, null);
        }
        unsubscribed.add(topic);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    public int callCount() {
        return subscribed.size() + unsubscribed.size();
    }

    public void reset() {
        subscribed.clear();
        unsubscribed.clear();
    }
}
