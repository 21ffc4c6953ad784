package com.qqsuccubus.telemetry.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code telemetry.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Samples accepted by the ingestion pipeline.
     * <p>
     * Tags: station_id, outcome (recorded/cached)
     * </p>
     */
    public static final String SAMPLES_ACCEPTED_TOTAL = "telemetry.ingest.samples.total";

    /**
     * Counter: Samples dropped before reaching the buffers.
     * <p>
     * Tags: station_id, reason
     * </p>
     */
    public static final String SAMPLES_DROPPED_TOTAL = "telemetry.ingest.drops.total";

    /**
     * Counter: Discovery announcements received on the supervisor connection.
     */
    public static final String ANNOUNCEMENTS_TOTAL = "telemetry.discovery.announcements.total";

    /**
     * Counter: Sensors evicted from discovery for being stale.
     */
    public static final String EVICTIONS_TOTAL = "telemetry.discovery.evictions.total";

    /**
     * Counter: Failed subscribe/unsubscribe calls.
     * <p>
     * Tags: station_id, operation
     * </p>
     */
    public static final String SUBSCRIPTION_FAILURES_TOTAL = "telemetry.selection.subscription.failures.total";

    /**
     * Counter: Full state resets caused by a change of the selected sensor set.
     */
    public static final String SELECTION_RESETS_TOTAL = "telemetry.selection.resets.total";

    /**
     * Counter: Series saved to the snapshot store.
     */
    public static final String SERIES_SAVED_TOTAL = "telemetry.session.series.saved.total";

    /**
     * Counter: Sessions stopped by the duration limit.
     */
    public static final String AUTO_STOPS_TOTAL = "telemetry.session.autostops.total";

    /**
     * Gauge: Rows currently held in the live time buffer.
     */
    public static final String BUFFERED_SAMPLES = "telemetry.session.buffered.samples";

    /**
     * Gauge: Number of selected sensors.
     */
    public static final String SELECTED_SENSORS = "telemetry.selection.sensors";

    /**
     * Gauge: Number of sensors currently announcing.
     */
    public static final String DISCOVERED_SENSORS = "telemetry.discovery.sensors";
}
