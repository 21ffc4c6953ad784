package com.qqsuccubus.telemetry.station.mqtt;

import com.qqsuccubus.telemetry.core.msg.Topics;
import com.qqsuccubus.telemetry.core.util.JsonUtils;
import com.qqsuccubus.telemetry.station.discovery.IDiscoveryTracker;
import com.qqsuccubus.telemetry.station.ingest.IngestOutcome;
import com.qqsuccubus.telemetry.station.ingest.IngestionPipeline;
import com.qqsuccubus.telemetry.station.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for messages delivered by the two MQTT connections.
 * <p>
 * The supervisor connection only feeds discovery; the measurement connection feeds the
 * ingestion pipeline. Topics outside {prefix}/{sensorId}/data are ignored on both.
 * </p>
 */
public class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final String topicPrefix;
    private final IDiscoveryTracker discoveryTracker;
    private final IngestionPipeline pipeline;
    private final MetricsService metricsService;
    private final Clock clock;

    public MessageRouter(String topicPrefix,
                         IDiscoveryTracker discoveryTracker,
                         IngestionPipeline pipeline,
                         MetricsService metricsService,
                         Clock clock) {
        this.topicPrefix = topicPrefix;
        this.discoveryTracker = discoveryTracker;
        this.pipeline = pipeline;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public void onDiscoveryMessage(String topic, byte[] payload) {
        Optional<String> sensorId = Topics.sensorIdOf(topicPrefix, topic);
        if (sensorId.isEmpty()) {
            return;
        }
        metricsService.recordAnnouncement();
        discoveryTracker.onAnnouncement(sensorId.get(), clock.instant());
    }

    public IngestOutcome onDataMessage(String topic, byte[] payload) {
        Optional<String> sensorId = Topics.sensorIdOf(topicPrefix, topic);
        if (sensorId.isEmpty()) {
            metricsService.recordIngest(IngestOutcome.UNSELECTED);
            return IngestOutcome.UNSELECTED;
        }

        Optional<Map<String, Object>> fields = JsonUtils.readFields(payload);
        IngestOutcome outcome = fields.isPresent()
            ? pipeline.onSample(sensorId.get(), fields.get(), clock.instant())
            : IngestOutcome.MALFORMED;
        if (outcome == IngestOutcome.MALFORMED) {
            log.debug("Undecodable payload on {} ({} bytes)", topic, payload != null ? payload.length : 0);
        }
        metricsService.recordIngest(outcome);
        return outcome;
    }
}
