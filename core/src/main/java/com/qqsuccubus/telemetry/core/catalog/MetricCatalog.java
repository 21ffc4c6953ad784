package com.qqsuccubus.telemetry.core.catalog;

import com.qqsuccubus.telemetry.core.model.SensorProfile;

/**
 * Read-only lookup from sensor identifier to its profile.
 */
public interface MetricCatalog {
    /**
     * Resolves the profile for a sensor. Never returns {@code null}: unknown sensor types
     * resolve to {@link SensorProfile#fallback()}.
     *
     * @param sensorId Sensor identifier as seen on the topic (e.g. "SensorMov")
     * @return Sensor profile
     */
    SensorProfile profileFor(String sensorId);

    /**
     * @return Display name for the sensor's type, or the sensor id when the type has none
     */
    default String displayNameFor(String sensorId) {
        String name = profileFor(sensorId).getDisplayName();
        return name != null ? name : sensorId;
    }
}
