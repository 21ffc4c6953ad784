package com.qqsuccubus.telemetry.station.state;

import com.qqsuccubus.telemetry.core.buffer.TimeSeriesBuffer;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns every piece of mutable measurement state and the single lock guarding it.
 * <p>
 * Constructed once per station and shared by the selection manager, the ingestion pipeline, the
 * session controller and the snapshot store. Every accessor below must only be used inside
 * {@link #withLock(Supplier)} or {@link #runLocked(Runnable)}; the lock is reentrant so
 * components may call each other while holding it. It is never held across a transport call.
 * </p>
 */
public class TelemetryStateStore {

    private final ReentrantLock lock = new ReentrantLock();

    @Getter
    private final double defaultSamplePeriodSeconds;

    @Getter
    private final TimeSeriesBuffer series;
    @Getter
    private final LastValueCache lastValues = new LastValueCache();
    @Getter
    private final MeasurementSession session = new MeasurementSession();
    @Getter
    private final List<SeriesSnapshot> snapshots = new ArrayList<>();

    @Getter
    private ActiveSelection selection = ActiveSelection.empty();

    // null = live view, otherwise index into snapshots
    @Getter
    private Integer displayIndex;

    private int seriesCounter;

    public TelemetryStateStore(int bufferCapacity, double defaultSamplePeriodSeconds) {
        this.series = new TimeSeriesBuffer(bufferCapacity);
        this.defaultSamplePeriodSeconds = defaultSamplePeriodSeconds;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Installs a new selection and reconciles buffer columns and cache keys with its metric ids.
     */
    public void install(ActiveSelection next) {
        this.selection = next;
        series.reconcileColumns(next.getActiveQualifiedIds());
        lastValues.reconcile(next.getActiveQualifiedIds());
    }

    /**
     * Clears the live buffers, the last-value cache and the session. Saved series are untouched.
     */
    public void resetMeasurement() {
        series.clear();
        lastValues.clear();
        session.reset();
    }

    public void showLive() {
        displayIndex = null;
    }

    public void show(int snapshotIndex) {
        displayIndex = snapshotIndex;
    }

    public String nextSeriesName() {
        seriesCounter++;
        return "Series " + seriesCounter;
    }

    public void clearSnapshots() {
        snapshots.clear();
        seriesCounter = 0;
        displayIndex = null;
    }
}
