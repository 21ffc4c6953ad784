package com.qqsuccubus.telemetry.station.state;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which sensors and metrics are active. Replaced wholesale on every change.
 */
@Value
public class ActiveSelection {
    private static final ActiveSelection EMPTY = new ActiveSelection(
        Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyList());

    /**
     * Selected sensors, unique, in selection order.
     */
    List<String> selectedSensors;

    /**
     * Per-sensor metric restriction. A sensor without an entry has all of its metrics active.
     */
    Map<String, Set<String>> channelMap;

    /**
     * Data topic per selected sensor.
     */
    Map<String, String> topics;

    /**
     * Derived qualified metric ids ({@code sensorId:metricId}), in sensor then catalog order.
     */
    List<String> activeQualifiedIds;

    public ActiveSelection(List<String> selectedSensors,
                           Map<String, Set<String>> channelMap,
                           Map<String, String> topics,
                           List<String> activeQualifiedIds) {
        this.selectedSensors = Collections.unmodifiableList(new ArrayList<>(selectedSensors));
        Map<String, Set<String>> channels = new LinkedHashMap<>();
        channelMap.forEach((sensor, metrics) ->
            channels.put(sensor, Collections.unmodifiableSet(new LinkedHashSet<>(metrics))));
        this.channelMap = Collections.unmodifiableMap(channels);
        this.topics = Collections.unmodifiableMap(new LinkedHashMap<>(topics));
        this.activeQualifiedIds = Collections.unmodifiableList(new ArrayList<>(activeQualifiedIds));
    }

    public static ActiveSelection empty() {
        return EMPTY;
    }

    public boolean isSelected(String sensorId) {
        return topics.containsKey(sensorId);
    }

    /**
     * @return Active metric ids of {@code sensorId}, or {@code null} when all of its metrics are active
     */
    public Set<String> channelsOf(String sensorId) {
        return channelMap.get(sensorId);
    }

    public boolean isChannelActive(String sensorId, String metricId) {
        Set<String> channels = channelMap.get(sensorId);
        return channels == null || channels.contains(metricId);
    }
}
