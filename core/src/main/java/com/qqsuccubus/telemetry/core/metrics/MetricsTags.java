package com.qqsuccubus.telemetry.core.metrics;

/**
 * Micrometer tag keys used across the system.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Station identifier tag.
     */
    public static final String STATION_ID = "station_id";

    /**
     * Drop reason tag (unselected, missing_field, bad_timestamp, malformed).
     */
    public static final String REASON = "reason";

    /**
     * Subscription operation tag (subscribe, unsubscribe).
     */
    public static final String OPERATION = "operation";

    /**
     * Outcome tag for accepted samples (recorded, cached).
     */
    public static final String OUTCOME = "outcome";
}
