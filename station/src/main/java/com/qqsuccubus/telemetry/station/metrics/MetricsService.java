package com.qqsuccubus.telemetry.station.metrics;

import com.qqsuccubus.telemetry.core.metrics.MetricsNames;
import com.qqsuccubus.telemetry.core.metrics.MetricsTags;
import com.qqsuccubus.telemetry.station.config.StationConfig;
import com.qqsuccubus.telemetry.station.ingest.IngestOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics service for the telemetry station.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String stationId;

    // Counters
    private final Map<IngestOutcome, Counter> ingestOutcomes = new EnumMap<>(IngestOutcome.class);
    private final Counter announcements;
    private final Counter evictions;
    private final Counter subscribeFailures;
    private final Counter unsubscribeFailures;
    private final Counter selectionResets;
    private final Counter seriesSaved;
    private final Counter autoStops;

    public MetricsService(MeterRegistry registry, StationConfig config) {
        this.registry = registry;
        this.stationId = config.getStationId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        for (IngestOutcome outcome : IngestOutcome.values()) {
            String tagValue = outcome.name().toLowerCase(Locale.ROOT);
            Counter counter = outcome.isAccepted()
                ? Counter.builder(MetricsNames.SAMPLES_ACCEPTED_TOTAL)
                    .tag(MetricsTags.STATION_ID, stationId)
                    .tag(MetricsTags.OUTCOME, tagValue)
                    .description("Samples accepted by the ingestion pipeline")
                    .register(registry)
                : Counter.builder(MetricsNames.SAMPLES_DROPPED_TOTAL)
                    .tag(MetricsTags.STATION_ID, stationId)
                    .tag(MetricsTags.REASON, tagValue)
                    .description("Samples dropped before reaching the buffers")
                    .register(registry);
            ingestOutcomes.put(outcome, counter);
        }

        announcements = Counter.builder(MetricsNames.ANNOUNCEMENTS_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .description("Messages seen on the discovery connection")
            .register(registry);

        evictions = Counter.builder(MetricsNames.EVICTIONS_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .description("Sensors evicted for not publishing")
            .register(registry);

        subscribeFailures = Counter.builder(MetricsNames.SUBSCRIPTION_FAILURES_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .tag(MetricsTags.OPERATION, "subscribe")
            .register(registry);

        unsubscribeFailures = Counter.builder(MetricsNames.SUBSCRIPTION_FAILURES_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .tag(MetricsTags.OPERATION, "unsubscribe")
            .register(registry);

        selectionResets = Counter.builder(MetricsNames.SELECTION_RESETS_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .description("Full resets caused by a change of the selected sensor set")
            .register(registry);

        seriesSaved = Counter.builder(MetricsNames.SERIES_SAVED_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .register(registry);

        autoStops = Counter.builder(MetricsNames.AUTO_STOPS_TOTAL)
            .tag(MetricsTags.STATION_ID, stationId)
            .description("Sessions stopped by the duration limit")
            .register(registry);
    }

    /**
     * Registers a gauge sampled from {@code value} on every scrape.
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
            .tag(MetricsTags.STATION_ID, stationId)
            .description(description)
            .register(registry);
    }

    public void recordIngest(IngestOutcome outcome) {
        ingestOutcomes.get(outcome).increment();
    }

    public void recordAnnouncement() {
        announcements.increment();
    }

    public void recordEvictions(int count) {
        evictions.increment(count);
    }

    public void recordSubscribeFailure() {
        subscribeFailures.increment();
    }

    public void recordUnsubscribeFailure() {
        unsubscribeFailures.increment();
    }

    public void recordSelectionReset() {
        selectionResets.increment();
    }

    public void recordSeriesSaved() {
        seriesSaved.increment();
    }

    public void recordAutoStop() {
        autoStops.increment();
    }

    public double count(IngestOutcome outcome) {
        return ingestOutcomes.get(outcome).count();
    }

    public double subscribeFailureCount() {
        return subscribeFailures.count();
    }
}
