package com.qqsuccubus.telemetry.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the read path hands to the presentation layer on every refresh: either the live buffers
 * or a saved series, taken as one consistent copy.
 */
@Value
@Builder
public class TelemetryView {
    List<Double> times;
    Map<String, List<Double>> valuesByMetric;

    /**
     * Time of the most recent sample, {@code null} when nothing was recorded.
     */
    Double lastTime;

    /**
     * Most recent value per metric. For the live view this is the last-value cache, which is
     * updated even when no session is running.
     */
    Map<String, Double> lastValuesByMetric;

    /**
     * Publisher-side dropped-sample counter; always {@code null} for saved series.
     */
    Integer droppedCount;

    boolean live;

    /**
     * Name of the displayed series, {@code null} for the live view.
     */
    String seriesName;

    List<String> metricIds;
    SessionState sessionState;
    double elapsedSeconds;
    Double durationLimitSeconds;
}
