package com.qqsuccubus.telemetry.core.model;

/**
 * Helpers for the flat {@code sensorId:metricId} namespace shared by buffers and caches.
 * <p>
 * Sensor ids come from a single topic segment and therefore never contain '/', but they may
 * contain ':'; the metric id is always the part after the last separator.
 * </p>
 */
public final class QualifiedMetricId {
    private QualifiedMetricId() {
    }

    public static final char SEPARATOR = ':';

    public static String of(String sensorId, String metricId) {
        return sensorId + SEPARATOR + metricId;
    }

    public static String sensorOf(String qualifiedId) {
        int idx = qualifiedId.lastIndexOf(SEPARATOR);
        return idx < 0 ? qualifiedId : qualifiedId.substring(0, idx);
    }

    public static String metricOf(String qualifiedId) {
        int idx = qualifiedId.lastIndexOf(SEPARATOR);
        return idx < 0 ? qualifiedId : qualifiedId.substring(idx + 1);
    }
}
