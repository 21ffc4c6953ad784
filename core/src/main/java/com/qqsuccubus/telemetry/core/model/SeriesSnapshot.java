package com.qqsuccubus.telemetry.core.model;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frozen copy of a recorded session. Never mutated after creation.
 * <p>
 * Value lists may contain {@code null} entries for samples where a metric had no value.
 * </p>
 */
@Value
public class SeriesSnapshot {
    /**
     * Auto-numbered name ("Series 1", "Series 2", ...).
     */
    String name;

    List<Double> times;

    /**
     * Qualified metric id to recorded values, each list aligned with {@link #times}.
     */
    Map<String, List<Double>> values;

    /**
     * Qualified metric ids active when the series was saved, in display order.
     */
    List<String> metricIds;

    Instant savedAt;

    public SeriesSnapshot(String name,
                          List<Double> times,
                          Map<String, List<Double>> values,
                          List<String> metricIds,
                          Instant savedAt) {
        this.name = name;
        this.times = Collections.unmodifiableList(new ArrayList<>(times));
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (String metricId : metricIds) {
            List<Double> series = values.get(metricId);
            copy.put(metricId, Collections.unmodifiableList(
                series != null ? new ArrayList<>(series) : new ArrayList<>()));
        }
        this.values = Collections.unmodifiableMap(copy);
        this.metricIds = Collections.unmodifiableList(new ArrayList<>(metricIds));
        this.savedAt = savedAt;
    }

    public int size() {
        return times.size();
    }

    /**
     * Value of {@code metricId} at sample {@code index}, or {@code null} when absent.
     */
    public Double valueAt(String metricId, int index) {
        List<Double> series = values.get(metricId);
        if (series == null || index < 0 || index >= series.size()) {
            return null;
        }
        return series.get(index);
    }
}
