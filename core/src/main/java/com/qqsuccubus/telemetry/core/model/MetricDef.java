package com.qqsuccubus.telemetry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One scalar measurement channel exposed by a sensor type.
 * <p>
 * The display fields ({@code label}, {@code unit}, {@code color}, {@code hoverName}) are carried
 * through to the presentation layer untouched; the state engine only reads {@code id},
 * {@code sourceKey} and {@code scale}.
 * </p>
 */
@Value
public class MetricDef {
    /**
     * Metric identifier, unique within a sensor (e.g. "dist_m").
     */
    @JsonProperty("id")
    String id;

    /**
     * Key of the raw field in the inbound payload (e.g. "cm").
     */
    @JsonProperty("sourceKey")
    String sourceKey;

    /**
     * Multiplier applied to the raw value (cm to m = 0.01).
     */
    @JsonProperty("scale")
    double scale;

    @JsonProperty("label")
    String label;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("color")
    String color;

    @JsonProperty("hoverName")
    String hoverName;

    /**
     * Whether the metric starts enabled when the operator opens a sensor.
     */
    @JsonProperty("defaultEnabled")
    boolean defaultEnabled;

    @Builder
    @JsonCreator
    public MetricDef(
        @JsonProperty("id") String id,
        @JsonProperty("sourceKey") String sourceKey,
        @JsonProperty("scale") Double scale,
        @JsonProperty("label") String label,
        @JsonProperty("unit") String unit,
        @JsonProperty("color") String color,
        @JsonProperty("hoverName") String hoverName,
        @JsonProperty("defaultEnabled") Boolean defaultEnabled
    ) {
        this.id = id;
        this.sourceKey = sourceKey != null ? sourceKey : id;
        this.scale = scale != null ? scale : 1.0;
        this.label = label != null ? label : id;
        this.unit = unit;
        this.color = color;
        this.hoverName = hoverName != null ? hoverName : this.label;
        this.defaultEnabled = defaultEnabled == null || defaultEnabled;
    }
}
