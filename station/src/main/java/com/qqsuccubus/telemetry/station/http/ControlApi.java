package com.qqsuccubus.telemetry.station.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.telemetry.core.error.EmptyRecordingException;
import com.qqsuccubus.telemetry.core.error.InvalidSelectionException;
import com.qqsuccubus.telemetry.core.model.DurationUnit;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import com.qqsuccubus.telemetry.core.util.JsonUtils;
import com.qqsuccubus.telemetry.station.control.ITelemetryStation;
import com.qqsuccubus.telemetry.station.export.SeriesCsvExporter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON control endpoints, independent of the HTTP server so they can be exercised directly.
 * <p>
 * {@link InvalidSelectionException} maps to 400, {@link EmptyRecordingException} to 409 and an
 * unreadable request body to 400.
 * </p>
 */
@RequiredArgsConstructor
public class ControlApi {
    private static final Logger log = LoggerFactory.getLogger(ControlApi.class);

    private final ITelemetryStation station;

    public ApiResponse listSensors() {
        return ok(station.listSensors());
    }

    public ApiResponse getSelection() {
        return handle(() -> {
            Map<String, Object> body = new LinkedHashMap<>();
            List<String> sensors = station.selectedSensors();
            body.put("sensors", sensors);
            Map<String, Object> channels = new LinkedHashMap<>();
            for (String sensorId : sensors) {
                channels.put(sensorId, station.channelsFor(sensorId));
            }
            body.put("channels", channels);
            return ok(body);
        });
    }

    public ApiResponse putSelection(String requestBody) {
        return handle(() -> {
            station.setSensors(textArray(parse(requestBody), "sensors"));
            return getSelection();
        });
    }

    public ApiResponse putChannels(String sensorId, String requestBody) {
        return handle(() -> {
            station.setChannels(sensorId, textArray(parse(requestBody), "channels"));
            return ok(station.channelsFor(sensorId));
        });
    }

    public ApiResponse start() {
        return handle(() -> {
            station.start();
            return session();
        });
    }

    public ApiResponse stop() {
        return handle(() -> {
            station.stop();
            return session();
        });
    }

    public ApiResponse save() {
        return handle(() -> ok(summary(station.save())));
    }

    public ApiResponse putDuration(String requestBody) {
        return handle(() -> {
            JsonNode body = parse(requestBody);
            JsonNode value = body.get("value");
            if (value == null || !value.isNumber()) {
                throw new BadRequestException("'value' must be a number");
            }
            DurationUnit unit = DurationUnit.SECONDS;
            JsonNode unitNode = body.get("unit");
            if (unitNode != null && !unitNode.isNull()) {
                try {
                    unit = DurationUnit.valueOf(unitNode.asText().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new BadRequestException("Unknown unit: " + unitNode.asText());
                }
            }
            station.configureDuration(value.asDouble(), unit);
            return session();
        });
    }

    public ApiResponse view() {
        return handle(() -> ok(station.currentView()));
    }

    public ApiResponse listSeries() {
        return handle(() -> {
            List<Map<String, Object>> series = new ArrayList<>();
            for (SeriesSnapshot snapshot : station.snapshots()) {
                series.add(summary(snapshot));
            }
            return ok(series);
        });
    }

    public ApiResponse putDisplay(String requestBody) {
        return handle(() -> {
            JsonNode name = parse(requestBody).get("name");
            boolean shown = station.selectForDisplay(name == null || name.isNull() ? null : name.asText());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("live", !shown);
            body.put("name", shown ? name.asText() : null);
            return ok(body);
        });
    }

    public ApiResponse clearSeries() {
        return handle(() -> {
            station.clearAll();
            return ApiResponse.json(204, "");
        });
    }

    public ApiResponse exportSeries() {
        return handle(() -> new ApiResponse(200, ApiResponse.CSV, SeriesCsvExporter.toCsv(station.snapshots())));
    }

    private ApiResponse session() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", station.sessionState());
        return ok(body);
    }

    private static Map<String, Object> summary(SeriesSnapshot snapshot) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", snapshot.getName());
        body.put("samples", snapshot.size());
        body.put("metricIds", snapshot.getMetricIds());
        body.put("savedAt", snapshot.getSavedAt());
        return body;
    }

    private static ApiResponse ok(Object body) {
        return ApiResponse.json(200, JsonUtils.writeValueAsString(body));
    }

    private static ApiResponse handle(Supplier<ApiResponse> action) {
        try {
            return action.get();
        } catch (InvalidSelectionException | BadRequestException e) {
            log.debug("Rejected request: {}", e.getMessage());
            return ApiResponse.error(400, e.getMessage());
        } catch (EmptyRecordingException e) {
            log.debug("Rejected save: {}", e.getMessage());
            return ApiResponse.error(409, e.getMessage());
        }
    }

    private static JsonNode parse(String requestBody) {
        if (requestBody == null || requestBody.isBlank()) {
            throw new BadRequestException("Request body is required");
        }
        try {
            JsonNode node = JsonUtils.mapper().readTree(requestBody);
            if (node == null || !node.isObject()) {
                throw new BadRequestException("Request body must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Malformed JSON: " + e.getOriginalMessage());
        }
    }

    private static List<String> textArray(JsonNode body, String field) {
        JsonNode array = body.get(field);
        if (array == null || !array.isArray()) {
            throw new BadRequestException("'" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            values.add(element.asText());
        }
        return values;
    }

    private static final class BadRequestException extends RuntimeException {
        BadRequestException(String message) {
            super(message);
        }
    }
}
