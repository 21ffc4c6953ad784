package com.qqsuccubus.telemetry.core.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.telemetry.core.model.MetricDef;
import com.qqsuccubus.telemetry.core.model.SensorProfile;
import com.qqsuccubus.telemetry.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Metric catalog backed by a fixed table of sensor types, typically loaded from the
 * {@code sensor-types.json} classpath resource.
 * <p>
 * Resource layout:
 * <pre>
 * {
 *   "fallback": { "requiredFields": ["t_ms"], "metrics": [], "droppedCountField": "avg_dropped" },
 *   "types": {
 *     "Mov": { "name": "...", "requiredFields": [...], "metrics": [ {...} ] }
 *   }
 * }
 * </pre>
 * </p>
 */
public class StaticMetricCatalog implements MetricCatalog {
    private static final Logger log = LoggerFactory.getLogger(StaticMetricCatalog.class);

    public static final String DEFAULT_RESOURCE = "sensor-types.json";

    private final Map<String, SensorProfile> profilesByType;
    private final SensorProfile fallback;

    public StaticMetricCatalog(Map<String, SensorProfile> profilesByType, SensorProfile fallback) {
        for (Map.Entry<String, SensorProfile> entry : profilesByType.entrySet()) {
            validate(entry.getKey(), entry.getValue());
        }
        this.profilesByType = Collections.unmodifiableMap(new LinkedHashMap<>(profilesByType));
        this.fallback = fallback != null ? fallback : SensorProfile.fallback();
    }

    /**
     * Loads the catalog from a classpath resource.
     *
     * @param resource Resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return Catalog
     * @throws IllegalArgumentException if the resource does not exist or declares duplicate metric ids
     */
    public static StaticMetricCatalog fromClasspath(String resource) {
        ClassLoader loader = StaticMetricCatalog.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Catalog resource not found: " + resource);
            }
            CatalogDocument document = JsonUtils.mapper().readValue(in, CatalogDocument.class);
            StaticMetricCatalog catalog = new StaticMetricCatalog(
                document.types != null ? document.types : Collections.emptyMap(),
                document.fallback
            );
            log.info("Loaded metric catalog from {}: types={}", resource, catalog.types());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog resource " + resource, e);
        }
    }

    @Override
    public SensorProfile profileFor(String sensorId) {
        return profilesByType.getOrDefault(SensorTypes.typeOf(sensorId), fallback);
    }

    public Set<String> types() {
        return profilesByType.keySet();
    }

    private static void validate(String type, SensorProfile profile) {
        Set<String> seen = new HashSet<>();
        for (MetricDef metric : profile.getMetrics()) {
            if (metric.getId() == null || !seen.add(metric.getId())) {
                throw new IllegalArgumentException(
                    "Sensor type " + type + " declares a missing or duplicate metric id: " + metric.getId());
            }
        }
    }

    private static final class CatalogDocument {
        final SensorProfile fallback;
        final Map<String, SensorProfile> types;

        @JsonCreator
        CatalogDocument(
            @JsonProperty("fallback") SensorProfile fallback,
            @JsonProperty("types") Map<String, SensorProfile> types
        ) {
            this.fallback = fallback;
            this.types = types;
        }
    }
}
