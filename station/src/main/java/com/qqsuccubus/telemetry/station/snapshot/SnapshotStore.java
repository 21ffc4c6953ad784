package com.qqsuccubus.telemetry.station.snapshot;

import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import com.qqsuccubus.telemetry.core.model.TelemetryView;
import com.qqsuccubus.telemetry.station.state.LastValueCache;
import com.qqsuccubus.telemetry.station.state.MeasurementSession;
import com.qqsuccubus.telemetry.station.state.TelemetryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saved series plus the pointer choosing between the live view and one saved series.
 */
public class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final TelemetryStateStore store;

    public SnapshotStore(TelemetryStateStore store) {
        this.store = store;
    }

    public void append(SeriesSnapshot snapshot) {
        store.runLocked(() -> store.getSnapshots().add(snapshot));
    }

    /**
     * Chooses what {@link #currentView()} returns.
     * <p>
     * {@code null} selects the live view. A name selects the first series with that name and
     * stops a running session; an unknown name falls back to the live view.
     * </p>
     *
     * @param name Series name, or {@code null} for live
     * @return {@code true} if a saved series is now displayed
     */
    public boolean selectForDisplay(String name) {
        boolean found = store.withLock(() -> {
            if (name == null) {
                store.showLive();
                return false;
            }
            List<SeriesSnapshot> snapshots = store.getSnapshots();
            for (int i = 0; i < snapshots.size(); i++) {
                if (snapshots.get(i).getName().equals(name)) {
                    MeasurementSession session = store.getSession();
                    if (session.isRunning()) {
                        session.halt();
                    }
                    store.show(i);
                    return true;
                }
            }
            store.showLive();
            return false;
        });
        if (name != null && !found) {
            log.debug("Series '{}' not found, showing live view", name);
        }
        return found;
    }

    /**
     * Drops every saved series and returns to the live view. Selection, discovery and the live
     * buffers are untouched.
     */
    public void clearAll() {
        int dropped = store.withLock(() -> {
            int count = store.getSnapshots().size();
            store.clearSnapshots();
            return count;
        });
        log.info("Cleared {} saved series", dropped);
    }

    public List<String> names() {
        return store.withLock(() -> {
            List<String> names = new ArrayList<>();
            for (SeriesSnapshot snapshot : store.getSnapshots()) {
                names.add(snapshot.getName());
            }
            return names;
        });
    }

    public List<SeriesSnapshot> snapshots() {
        return store.withLock(() -> Collections.unmodifiableList(new ArrayList<>(store.getSnapshots())));
    }

    public int size() {
        return store.withLock(() -> store.getSnapshots().size());
    }

    /**
     * One consistent copy of what should be displayed: the live buffers and last-value cache, or
     * the selected saved series with its final entries as "last" values and no dropped count.
     */
    public TelemetryView currentView() {
        return store.withLock(() -> {
            MeasurementSession session = store.getSession();
            TelemetryView.TelemetryViewBuilder view = TelemetryView.builder()
                .sessionState(session.getState())
                .elapsedSeconds(session.getElapsedSeconds())
                .durationLimitSeconds(session.getDurationLimitSeconds());

            Integer index = store.getDisplayIndex();
            if (index == null || index < 0 || index >= store.getSnapshots().size()) {
                return liveView(view);
            }
            return snapshotView(view, store.getSnapshots().get(index));
        });
    }

    private TelemetryView liveView(TelemetryView.TelemetryViewBuilder view) {
        LastValueCache cache = store.getLastValues();
        List<String> metricIds = store.getSelection().getActiveQualifiedIds();

        Map<String, Double> lastValues = new LinkedHashMap<>();
        for (String metricId : metricIds) {
            lastValues.put(metricId, cache.get(metricId));
        }
        return view
            .live(true)
            .metricIds(metricIds)
            .times(Collections.unmodifiableList(store.getSeries().times()))
            .valuesByMetric(Collections.unmodifiableMap(store.getSeries().valuesByColumn()))
            .lastTime(cache.getLastElapsedSeconds())
            .lastValuesByMetric(Collections.unmodifiableMap(lastValues))
            .droppedCount(cache.getLastDroppedCount())
            .build();
    }

    private static TelemetryView snapshotView(TelemetryView.TelemetryViewBuilder view, SeriesSnapshot snapshot) {
        List<Double> times = snapshot.getTimes();
        Map<String, Double> lastValues = new LinkedHashMap<>();
        for (String metricId : snapshot.getMetricIds()) {
            List<Double> values = snapshot.getValues().get(metricId);
            lastValues.put(metricId, values == null || values.isEmpty() ? null : values.get(values.size() - 1));
        }
        return view
            .live(false)
            .seriesName(snapshot.getName())
            .metricIds(snapshot.getMetricIds())
            .times(times)
            .valuesByMetric(snapshot.getValues())
            .lastTime(times.isEmpty() ? null : times.get(times.size() - 1))
            .lastValuesByMetric(Collections.unmodifiableMap(lastValues))
            .droppedCount(null)
            .build();
    }
}
