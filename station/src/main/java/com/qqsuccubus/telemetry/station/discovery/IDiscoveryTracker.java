package com.qqsuccubus.telemetry.station.discovery;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which sensors are currently announcing themselves.
 */
public interface IDiscoveryTracker {
    /**
     * Records or refreshes the last-seen time of a sensor.
     *
     * @param sensorId Sensor identifier
     * @param seenAt   Time the announcement was received
     */
    void onAnnouncement(String sensorId, Instant seenAt);

    /**
     * Returns sensors seen within {@code staleAfter} of {@code now}, evicting the others.
     * Evicted ids are reported to the eviction listener.
     *
     * @param now        Current time
     * @param staleAfter Maximum silence before a sensor is considered gone
     * @return Active sensors, sorted
     */
    Set<String> activeSensors(Instant now, Duration staleAfter);

    /**
     * @return Every tracked sensor, sorted, without evicting anything
     */
    Set<String> knownSensors();

    Optional<Instant> lastSeen(String sensorId);
}
