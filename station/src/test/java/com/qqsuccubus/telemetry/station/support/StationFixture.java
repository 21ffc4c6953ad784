package com.qqsuccubus.telemetry.station.support;

import com.qqsuccubus.telemetry.core.catalog.StaticMetricCatalog;
import com.qqsuccubus.telemetry.station.config.StationConfig;
import com.qqsuccubus.telemetry.station.control.TelemetryStation;
import com.qqsuccubus.telemetry.station.discovery.DiscoveryTracker;
import com.qqsuccubus.telemetry.station.ingest.IngestOutcome;
import com.qqsuccubus.telemetry.station.ingest.IngestionPipeline;
import com.qqsuccubus.telemetry.station.metrics.MetricsService;
import com.qqsuccubus.telemetry.station.mqtt.MessageRouter;
import com.qqsuccubus.telemetry.station.selection.SelectionManager;
import com.qqsuccubus.telemetry.station.session.SessionController;
import com.qqsuccubus.telemetry.station.snapshot.SnapshotStore;
import com.qqsuccubus.telemetry.station.state.TelemetryStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Station components wired the way the application wires them, over a recording transport.
 */
public class StationFixture {
    public static final String PREFIX = "EQ1";

    public final StationConfig config;
    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final RecordingTransport transport = new RecordingTransport();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final MetricsService metrics;
    public final StaticMetricCatalog catalog = StaticMetricCatalog.fromClasspath(StaticMetricCatalog.DEFAULT_RESOURCE);
    public final TelemetryStateStore store;
    public final SelectionManager selection;
    public final DiscoveryTracker discovery;
    public final SnapshotStore snapshots;
    public final SessionController session;
    public final IngestionPipeline pipeline;
    public final MessageRouter router;
    public final TelemetryStation station;

    public StationFixture() {
        this(config().build());
    }

    public StationFixture(StationConfig config) {
        this.config = config;
        this.metrics = new MetricsService(registry, config);
        this.store = new TelemetryStateStore(config.bufferCapacity(), config.samplePeriodSeconds());
        this.selection = new SelectionManager(store, catalog, transport, metrics, config.getTopicPrefix());
        this.discovery = new DiscoveryTracker(evicted -> {
            metrics.recordEvictions(evicted.size());
            selection.dropSensors(evicted);
        });
        this.snapshots = new SnapshotStore(store);
        this.session = new SessionController(store, snapshots, metrics, clock);
        this.pipeline = new IngestionPipeline(store, catalog);
        this.router = new MessageRouter(config.getTopicPrefix(), discovery, pipeline, metrics, clock);
        this.station = new TelemetryStation(discovery, selection, session, snapshots, clock, config.getSensorStaleAfter());
    }

    public static StationConfig.StationConfigBuilder config() {
        return StationConfig.builder()
            .stationId("test-station")
            .httpPort(0)
            .brokerUrl("tcp://localhost:1883")
            .topicPrefix(PREFIX)
            .mqttQos(0)
            .sampleHz(4)
            .windowSeconds(60)
            .bufferMargin(10)
            .refreshInterval(Duration.ofMillis(250))
            .sensorStaleAfter(Duration.ofSeconds(5))
            .catalogResource(StaticMetricCatalog.DEFAULT_RESOURCE);
    }

    public IngestOutcome mov(long tMs, double cm) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("t_ms", tMs);
        fields.put("cm", cm);
        fields.put("v_cm_s", 10);
        fields.put("a_cm_s2", 0);
        return pipeline.onSample("SensorMov", fields, clock.instant());
    }

    public IngestOutcome lux(long tMs, double lux) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("t_ms", tMs);
        fields.put("Lux", lux);
        return pipeline.onSample("SensorLux", fields, clock.instant());
    }
}
