package com.qqsuccubus.telemetry.station;

import com.qqsuccubus.telemetry.core.catalog.StaticMetricCatalog;
import com.qqsuccubus.telemetry.core.error.SubscriptionException;
import com.qqsuccubus.telemetry.core.metrics.MetricsNames;
import com.qqsuccubus.telemetry.core.msg.Topics;
import com.qqsuccubus.telemetry.station.config.StationConfig;
import com.qqsuccubus.telemetry.station.control.TelemetryStation;
import com.qqsuccubus.telemetry.station.discovery.DiscoveryTracker;
import com.qqsuccubus.telemetry.station.http.ControlApi;
import com.qqsuccubus.telemetry.station.http.HttpServer;
import com.qqsuccubus.telemetry.station.ingest.IngestionPipeline;
import com.qqsuccubus.telemetry.station.metrics.MetricsService;
import com.qqsuccubus.telemetry.station.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.telemetry.station.mqtt.MessageRouter;
import com.qqsuccubus.telemetry.station.mqtt.MqttTransport;
import com.qqsuccubus.telemetry.station.selection.SelectionManager;
import com.qqsuccubus.telemetry.station.session.SessionController;
import com.qqsuccubus.telemetry.station.snapshot.SnapshotStore;
import com.qqsuccubus.telemetry.station.state.TelemetryStateStore;
import com.qqsuccubus.telemetry.station.tick.RefreshTicker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.time.Clock;

/**
 * Main entry point for the telemetry station.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Discover sensors over the supervisor MQTT connection</li>
 *   <li>Subscribe the selected sensors' data topics over the measurement connection</li>
 *   <li>Record measurement sessions and keep saved series in memory</li>
 *   <li>Expose /healthz, /metrics and the /api/v1 control endpoints</li>
 * </ul>
 * </p>
 */
public class StationApp {
    private static final Logger log = LoggerFactory.getLogger(StationApp.class);

    public static void main(String[] args) {
        StationConfig config = StationConfig.fromEnv();
        MDC.put("stationId", config.getStationId());

        log.info("Starting telemetry station: {}", config.getStationId());
        log.info("  Broker: {}", config.getBrokerUrl());
        log.info("  Topic prefix: {}", config.getTopicPrefix());
        log.info("  Buffer: {} rows ({} Hz x {} s + {})",
            config.bufferCapacity(), config.getSampleHz(), config.getWindowSeconds(), config.getBufferMargin());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getStationId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        StaticMetricCatalog catalog = StaticMetricCatalog.fromClasspath(config.getCatalogResource());
        TelemetryStateStore store = new TelemetryStateStore(config.bufferCapacity(), config.samplePeriodSeconds());

        MqttTransport measurement = new MqttTransport("measurement", config.getBrokerUrl(),
            config.getStationId() + "-measurement", config.getMqttUser(), config.getMqttPass(), config.getMqttQos());
        MqttTransport supervisor = new MqttTransport("supervisor", config.getBrokerUrl(),
            config.getStationId() + "-supervisor", config.getSupervisorUser(), config.getSupervisorPass(),
            config.getMqttQos());

        SelectionManager selectionManager = new SelectionManager(
            store, catalog, measurement, metricsService, config.getTopicPrefix()
        );
        DiscoveryTracker discoveryTracker = new DiscoveryTracker(evicted -> {
            metricsService.recordEvictions(evicted.size());
            selectionManager.dropSensors(evicted);
        });
        SnapshotStore snapshotStore = new SnapshotStore(store);
        SessionController sessionController = new SessionController(store, snapshotStore, metricsService, clock);
        IngestionPipeline pipeline = new IngestionPipeline(store, catalog);
        MessageRouter router = new MessageRouter(
            config.getTopicPrefix(), discoveryTracker, pipeline, metricsService, clock
        );

        metricsService.registerGauge(MetricsNames.BUFFERED_SAMPLES, "Rows in the live buffers",
            () -> store.withLock(() -> store.getSeries().size()));
        metricsService.registerGauge(MetricsNames.SELECTED_SENSORS, "Currently selected sensors",
            () -> selectionManager.selectedSensors().size());
        metricsService.registerGauge(MetricsNames.DISCOVERED_SENSORS, "Sensors in the discovery table",
            () -> discoveryTracker.knownSensors().size());

        String discoveryTopic = Topics.discoveryWildcard(config.getTopicPrefix());
        supervisor.connect(router::onDiscoveryMessage, () -> {
            try {
                supervisor.subscribe(discoveryTopic);
            } catch (SubscriptionException e) {
                metricsService.recordSubscribeFailure();
                log.warn("Discovery subscription to {} refused", discoveryTopic, e);
            }
        });
        measurement.connect(router::onDataMessage, selectionManager::resubscribeAll);

        TelemetryStation station = new TelemetryStation(
            discoveryTracker, selectionManager, sessionController, snapshotStore, clock, config.getSensorStaleAfter()
        );
        HttpServer httpServer = new HttpServer(config, new ControlApi(station), metricsExporter, measurement);
        httpServer.start();

        RefreshTicker ticker = new RefreshTicker(
            sessionController, discoveryTracker, clock, config.getRefreshInterval(), config.getSensorStaleAfter()
        );
        Disposable ticks = ticker.start();

        log.info("Telemetry station {} is ready", config.getStationId());

        handleShutdown(config, ticks, httpServer, measurement, supervisor);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(StationConfig config,
                                       Disposable ticks,
                                       HttpServer httpServer,
                                       MqttTransport measurement,
                                       MqttTransport supervisor) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, stopping station...");
            MDC.put("stationId", config.getStationId());

            ticks.dispose();
            httpServer.stop();
            measurement.disconnect();
            supervisor.disconnect();

            log.info("Shutdown complete");
        }));
    }
}
