package com.qqsuccubus.telemetry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of a sensor type: what a payload must contain and which metrics it yields.
 */
@Value
public class SensorProfile {
    public static final String DEFAULT_TIMESTAMP_FIELD = "t_ms";

    /**
     * Human-readable name of the sensor type (optional).
     */
    @JsonProperty("name")
    String displayName;

    /**
     * Fields that must be present in every payload. Always contains the timestamp field.
     */
    @JsonProperty("requiredFields")
    Set<String> requiredFields;

    /**
     * Ordered metric definitions.
     */
    @JsonProperty("metrics")
    List<MetricDef> metrics;

    /**
     * Optional payload field carrying the publisher's dropped-sample counter.
     */
    @JsonProperty("droppedCountField")
    String droppedCountField;

    /**
     * Per-type sample period; when absent the station-wide period applies.
     */
    @JsonProperty("samplePeriodSeconds")
    Double samplePeriodSeconds;

    @JsonProperty("timestampField")
    String timestampField;

    @Builder
    @JsonCreator
    public SensorProfile(
        @JsonProperty("name") String displayName,
        @JsonProperty("requiredFields") @Singular List<String> requiredFields,
        @JsonProperty("metrics") @Singular List<MetricDef> metrics,
        @JsonProperty("droppedCountField") String droppedCountField,
        @JsonProperty("samplePeriodSeconds") Double samplePeriodSeconds,
        @JsonProperty("timestampField") String timestampField
    ) {
        this.displayName = displayName;
        this.timestampField = timestampField != null ? timestampField : DEFAULT_TIMESTAMP_FIELD;

        Set<String> required = new LinkedHashSet<>();
        required.add(this.timestampField);
        if (requiredFields != null) {
            required.addAll(requiredFields);
        }
        this.requiredFields = Collections.unmodifiableSet(required);
        this.metrics = metrics != null
            ? Collections.unmodifiableList(new ArrayList<>(metrics))
            : Collections.emptyList();
        this.droppedCountField = droppedCountField;
        this.samplePeriodSeconds = samplePeriodSeconds;
    }

    /**
     * Profile used for sensors whose type is not in the catalog: only the timestamp is required
     * and no metrics are produced.
     */
    public static SensorProfile fallback() {
        return new SensorProfile(null, null, null, "avg_dropped", null, null);
    }

    @JsonIgnore
    public Optional<MetricDef> metric(String metricId) {
        return metrics.stream().filter(m -> m.getId().equals(metricId)).findFirst();
    }

    @JsonIgnore
    public List<String> metricIds() {
        List<String> ids = new ArrayList<>(metrics.size());
        for (MetricDef metric : metrics) {
            ids.add(metric.getId());
        }
        return ids;
    }

    @JsonIgnore
    public List<String> defaultMetricIds() {
        List<String> ids = new ArrayList<>();
        for (MetricDef metric : metrics) {
            if (metric.isDefaultEnabled()) {
                ids.add(metric.getId());
            }
        }
        return ids;
    }
}
