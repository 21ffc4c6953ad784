package com.qqsuccubus.telemetry.core.msg;

import java.util.Optional;

public final class Topics {
    private Topics() {
    }

    /**
     * Last path segment of every per-sensor data topic.
     */
    public static final String DATA_SUFFIX = "data";

    /**
     * Wildcard the supervisor connection subscribes to for discovery.
     *
     * @param prefix Root prefix, e.g. "EQ1"
     * @return Topic filter: {prefix}/#
     */
    public static String discoveryWildcard(String prefix) {
        return prefix + "/#";
    }

    /**
     * Generates the data topic for a sensor.
     *
     * @param prefix   Root prefix, e.g. "EQ1"
     * @param sensorId Sensor identifier
     * @return Topic name: {prefix}/{sensorId}/data
     */
    public static String dataTopicFor(String prefix, String sensorId) {
        return prefix + "/" + sensorId + "/" + DATA_SUFFIX;
    }

    /**
     * Extracts the sensor id from a data topic.
     * <p>
     * Matches {prefix}/{sensorId}/data and deeper topics sharing that head; anything else,
     * including an empty sensor segment, yields empty.
     * </p>
     *
     * @param prefix Root prefix
     * @param topic  Topic of an inbound message
     * @return Sensor id, if the topic is a data topic under {@code prefix}
     */
    public static Optional<String> sensorIdOf(String prefix, String topic) {
        if (topic == null || topic.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = topic.split("/", -1);
        if (parts.length < 3 || !parts[0].equals(prefix) || !parts[2].equals(DATA_SUFFIX)) {
            return Optional.empty();
        }
        String sensorId = parts[1];
        return sensorId.isEmpty() ? Optional.empty() : Optional.of(sensorId);
    }
}
