package com.qqsuccubus.telemetry.core.catalog;

/**
 * Derives the catalog type key from a sensor identifier.
 * <p>
 * Sensors follow the naming convention {@code Sensor<Type>}: "SensorMov" is of type "Mov".
 * Identifiers outside the convention are their own type key.
 * </p>
 */
public final class SensorTypes {
    private SensorTypes() {
    }

    public static final String SENSOR_PREFIX = "Sensor";

    public static String typeOf(String sensorId) {
        if (sensorId.startsWith(SENSOR_PREFIX) && sensorId.length() > SENSOR_PREFIX.length()) {
            return sensorId.substring(SENSOR_PREFIX.length());
        }
        return sensorId;
    }
}
