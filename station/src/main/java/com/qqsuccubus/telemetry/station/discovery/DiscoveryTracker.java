package com.qqsuccubus.telemetry.station.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Last-seen table of announcing sensors.
 * <p>
 * Guarded by its own lock, independent of the measurement state lock, so discovery traffic never
 * serializes against ingestion. The eviction listener runs after the lock is released.
 * </p>
 */
public class DiscoveryTracker implements IDiscoveryTracker {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryTracker.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Instant> lastSeen = new HashMap<>();
    private final Consumer<Set<String>> evictionListener;

    public DiscoveryTracker(Consumer<Set<String>> evictionListener) {
        this.evictionListener = evictionListener;
    }

    @Override
    public void onAnnouncement(String sensorId, Instant seenAt) {
        if (sensorId == null || sensorId.isEmpty()) {
            return;
        }
        boolean isNew;
        lock.lock();
        try {
            isNew = lastSeen.put(sensorId, seenAt) == null;
        } finally {
            lock.unlock();
        }
        if (isNew) {
            log.info("Discovered sensor {}", sensorId);
        }
    }

    @Override
    public Set<String> activeSensors(Instant now, Duration staleAfter) {
        Set<String> active = new TreeSet<>();
        Set<String> evicted = new TreeSet<>();
        lock.lock();
        try {
            Iterator<Map.Entry<String, Instant>> it = lastSeen.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Instant> entry = it.next();
                if (Duration.between(entry.getValue(), now).compareTo(staleAfter) > 0) {
                    evicted.add(entry.getKey());
                    it.remove();
                } else {
                    active.add(entry.getKey());
                }
            }
        } finally {
            lock.unlock();
        }

        if (!evicted.isEmpty()) {
            log.info("Sensors went stale after {}: {}", staleAfter, evicted);
            evictionListener.accept(Collections.unmodifiableSet(evicted));
        }
        return Collections.unmodifiableSet(active);
    }

    @Override
    public Set<String> knownSensors() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(lastSeen.keySet()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Instant> lastSeen(String sensorId) {
        lock.lock();
        try {
            return Optional.ofNullable(lastSeen.get(sensorId));
        } finally {
            lock.unlock();
        }
    }
}
