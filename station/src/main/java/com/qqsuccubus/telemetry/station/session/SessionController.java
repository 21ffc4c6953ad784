package com.qqsuccubus.telemetry.station.session;

import com.qqsuccubus.telemetry.core.error.EmptyRecordingException;
import com.qqsuccubus.telemetry.core.model.DurationUnit;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import com.qqsuccubus.telemetry.core.model.SessionState;
import com.qqsuccubus.telemetry.station.metrics.MetricsService;
import com.qqsuccubus.telemetry.station.snapshot.SnapshotStore;
import com.qqsuccubus.telemetry.station.state.MeasurementSession;
import com.qqsuccubus.telemetry.station.state.TelemetryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Drives the measurement session state machine.
 * <pre>
 * IDLE --start--> RUNNING --stop / duration reached--> STOPPED --start--> RUNNING
 * RUNNING | STOPPED --save--> IDLE
 * </pre>
 * Samples are only appended to the live buffers while RUNNING.
 */
public class SessionController {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final TelemetryStateStore store;
    private final SnapshotStore snapshotStore;
    private final MetricsService metricsService;
    private final Clock clock;

    public SessionController(TelemetryStateStore store,
                             SnapshotStore snapshotStore,
                             MetricsService metricsService,
                             Clock clock) {
        this.store = store;
        this.snapshotStore = snapshotStore;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Starts (or restarts) recording from t = 0 with empty live buffers and the live view selected.
     */
    public void start() {
        store.runLocked(() -> {
            store.getSeries().clear();
            store.getLastValues().setLastElapsedSeconds(null);
            store.getSession().begin();
            store.showLive();
        });
        log.info("Measurement started");
    }

    /**
     * Stops recording. No-op unless RUNNING.
     */
    public void stop() {
        boolean stopped = store.withLock(this::stopIfRunning);
        if (stopped) {
            log.info("Measurement stopped");
        }
    }

    /**
     * Sets the recording limit.
     *
     * @param value Limit in {@code unit}; zero or negative means unbounded
     * @param unit  Unit of {@code value}
     */
    public void configureDuration(double value, DurationUnit unit) {
        Double limit = value > 0 ? unit.toSeconds(value) : null;
        store.runLocked(() -> store.getSession().setDurationLimitSeconds(limit));
        log.info("Measurement duration set to {}", limit != null ? limit + " s" : "unbounded");
    }

    /**
     * Stops a running session whose elapsed time reached the limit. Polled on every refresh
     * tick, so the last sample may exceed the limit by at most one sample period.
     *
     * @return {@code true} if this call stopped the session
     */
    public boolean checkAutoStop() {
        boolean stopped = store.withLock(() -> {
            MeasurementSession session = store.getSession();
            return session.isRunning() && session.isDurationReached() && stopIfRunning();
        });
        if (stopped) {
            metricsService.recordAutoStop();
            log.info("Measurement stopped: duration limit reached");
        }
        return stopped;
    }

    /**
     * Archives the live buffers as a new series and returns to IDLE.
     *
     * @return The saved series
     * @throws EmptyRecordingException if no sample has been recorded; nothing changes
     */
    public SeriesSnapshot save() {
        SeriesSnapshot snapshot = store.withLock(() -> {
            if (store.getSeries().isEmpty()) {
                throw new EmptyRecordingException("No samples recorded, nothing to save");
            }
            SeriesSnapshot saved = new SeriesSnapshot(
                store.nextSeriesName(),
                store.getSeries().times(),
                store.getSeries().valuesByColumn(),
                store.getSelection().getActiveQualifiedIds(),
                clock.instant()
            );
            snapshotStore.append(saved);
            store.getSeries().clear();
            store.getLastValues().setLastElapsedSeconds(null);
            store.getSession().finish();
            store.showLive();
            return saved;
        });
        metricsService.recordSeriesSaved();
        log.info("Saved {} with {} samples", snapshot.getName(), snapshot.size());
        return snapshot;
    }

    public SessionState state() {
        return store.withLock(() -> store.getSession().getState());
    }

    private boolean stopIfRunning() {
        MeasurementSession session = store.getSession();
        if (!session.isRunning()) {
            return false;
        }
        session.halt();
        return true;
    }
}
