package com.qqsuccubus.telemetry.station.state;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Most recent scaled value per qualified metric id, kept whether or not a session is recording.
 * Guarded by the state store lock.
 */
@Getter
@Setter
public class LastValueCache {
    private final Map<String, Double> values = new LinkedHashMap<>();

    // Time axis position of the last buffered sample
    private Double lastElapsedSeconds;
    private Integer lastDroppedCount;
    private Instant lastReceivedAt;

    public Double get(String qualifiedId) {
        return values.get(qualifiedId);
    }

    public void put(String qualifiedId, Double value) {
        values.put(qualifiedId, value);
    }

    /**
     * Drops entries whose metric is no longer active and adds empty entries for new ones.
     */
    public void reconcile(Collection<String> activeIds) {
        Set<String> keep = new HashSet<>(activeIds);
        values.keySet().retainAll(keep);
        for (String id : activeIds) {
            values.putIfAbsent(id, null);
        }
    }

    public void clear() {
        values.replaceAll((id, value) -> null);
        lastElapsedSeconds = null;
        lastDroppedCount = null;
        lastReceivedAt = null;
    }

    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
