package com.qqsuccubus.telemetry.station.config;

import com.qqsuccubus.telemetry.core.buffer.TimeSeriesBuffer;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a telemetry station, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class StationConfig {

    String stationId;
    int httpPort;

    // MQTT broker and the two connections (measurement + supervisor/discovery)
    String brokerUrl;
    String mqttUser;
    String mqttPass;
    String supervisorUser;
    String supervisorPass;
    String topicPrefix;
    int mqttQos;

    // Time axis and buffer window
    double sampleHz;
    double windowSeconds;
    int bufferMargin;

    Duration refreshInterval;
    Duration sensorStaleAfter;

    String catalogResource;

    public static StationConfig fromEnv() {
        return StationConfig.builder()
                .stationId(getEnv("STATION_ID", "station-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8765")))
                .brokerUrl(getEnv("MQTT_BROKER_URL", "tcp://localhost:1883"))
                .mqttUser(getEnv("MQTT_USER", ""))
                .mqttPass(getEnv("MQTT_PASS", ""))
                .supervisorUser(getEnv("SUPERVISOR_USER", ""))
                .supervisorPass(getEnv("SUPERVISOR_PASS", ""))
                .topicPrefix(getEnv("TOPIC_PREFIX", "EQ1"))
                .mqttQos(Integer.parseInt(getEnv("MQTT_QOS", "0")))
                .sampleHz(Double.parseDouble(getEnv("SAMPLE_HZ", "4")))
                .windowSeconds(Double.parseDouble(getEnv("WINDOW_SEC", "60")))
                .bufferMargin(Integer.parseInt(getEnv("BUFFER_MARGIN", "10")))
                .refreshInterval(Duration.ofMillis(Long.parseLong(getEnv("REFRESH_MS", "250"))))
                .sensorStaleAfter(Duration.ofMillis((long) (Double.parseDouble(getEnv("SENSOR_STALE_SEC", "5")) * 1000)))
                .catalogResource(getEnv("CATALOG_RESOURCE", "sensor-types.json"))
                .build();
    }

    /**
     * Station-wide sample period, used for sensors whose profile does not set one.
     */
    public double samplePeriodSeconds() {
        return 1.0 / sampleHz;
    }

    /**
     * Rows kept per live buffer: ceil(window * rate) + margin.
     */
    public int bufferCapacity() {
        return TimeSeriesBuffer.capacityFor(windowSeconds, sampleHz, bufferMargin);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
