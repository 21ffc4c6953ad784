package com.qqsuccubus.telemetry.station.metrics;

import com.qqsuccubus.telemetry.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus metrics exporter backed by Micrometer's global composite registry, which is also
 * where reactor-netty publishes its HTTP server metrics.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String stationId) {
        CompositeMeterRegistry composite = Metrics.globalRegistry;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite.add(prometheusRegistry);
        this.registry = composite;

        registry.config().commonTags(MetricsTags.STATION_ID, stationId);
        log.info("Metrics exporter initialized with global registry + Prometheus");
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
