package com.qqsuccubus.telemetry.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Shared Jackson mapper for payload decoding, catalog loading and HTTP bodies.
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Decodes a telemetry payload into a field map.
     * <p>
     * Bytes are read as UTF-8 with malformed sequences replaced. Anything that is not a JSON
     * object yields an empty result instead of an exception.
     * </p>
     *
     * @param payload Raw message payload
     * @return Field map, or empty if the payload is not a JSON object
     */
    public static Optional<Map<String, Object>> readFields(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try {
            String text = new String(payload, StandardCharsets.UTF_8);
            return Optional.ofNullable(mapper().readValue(text, FIELD_MAP));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
