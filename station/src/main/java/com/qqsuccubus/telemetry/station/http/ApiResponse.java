package com.qqsuccubus.telemetry.station.http;

import com.qqsuccubus.telemetry.core.util.JsonUtils;
import lombok.Value;

/**
 * Status, content type and body of a control endpoint reply.
 */
@Value
public class ApiResponse {
    public static final String JSON = "application/json";
    public static final String CSV = "text/csv; charset=utf-8";

    int status;
    String contentType;
    String body;

    public static ApiResponse json(int status, String body) {
        return new ApiResponse(status, JSON, body);
    }

    public static ApiResponse error(int status, String message) {
        return json(status, "{\"error\":" + quote(message) + "}");
    }

    private static String quote(String message) {
        return JsonUtils.writeValueAsString(message);
    }
}
