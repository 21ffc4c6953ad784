package com.qqsuccubus.telemetry.station.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.telemetry.core.util.JsonUtils;
import com.qqsuccubus.telemetry.station.support.StationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControlApiTest {

    private StationFixture fx;
    private ControlApi api;

    @BeforeEach
    void setUp() {
        fx = new StationFixture();
        api = new ControlApi(fx.station);
    }

    private static JsonNode json(ApiResponse response) throws Exception {
        return JsonUtils.mapper().readTree(response.getBody());
    }

    @Test
    void testPutSelection_ReturnsSelectionWithChannels() throws Exception {
        ApiResponse response = api.putSelection("{\"sensors\":[\"SensorMov\",\"SensorLux\"]}");

        assertEquals(200, response.getStatus());
        JsonNode body = json(response);
        assertEquals("SensorMov", body.get("sensors").get(0).asText());
        assertEquals(3, body.get("channels").get("SensorMov").size());
        assertEquals("dist_m", body.get("channels").get("SensorMov").get(0).get("metric").get("id").asText());
        assertTrue(body.get("channels").get("SensorMov").get(0).get("active").asBoolean());
    }

    @Test
    void testEmptyChannels_BadRequest() {
        api.putSelection("{\"sensors\":[\"SensorMov\"]}");

        ApiResponse response = api.putChannels("SensorMov", "{\"channels\":[]}");

        assertEquals(400, response.getStatus());
        assertTrue(response.getBody().contains("error"));
    }

    @Test
    void testMalformedBody_BadRequest() {
        assertEquals(400, api.putSelection("not json").getStatus());
        assertEquals(400, api.putSelection("").getStatus());
        assertEquals(400, api.putSelection("{\"sensors\":\"SensorMov\"}").getStatus());
        assertEquals(400, api.putDuration("{\"value\":\"soon\"}").getStatus());
        assertEquals(400, api.putDuration("{\"value\":3,\"unit\":\"HOURS\"}").getStatus());
    }

    @Test
    void testSaveWithoutSamples_Conflict() {
        api.putSelection("{\"sensors\":[\"SensorLux\"]}");
        api.start();

        assertEquals(409, api.save().getStatus());
    }

    @Test
    void testSessionLifecycle() throws Exception {
        api.putSelection("{\"sensors\":[\"SensorLux\"]}");
        assertEquals("RUNNING", json(api.start()).get("state").asText());
        fx.lux(0, 12);

        JsonNode saved = json(api.save());
        assertEquals("Series 1", saved.get("name").asText());
        assertEquals(1, saved.get("samples").asInt());

        assertEquals(1, json(api.listSeries()).size());
        JsonNode display = json(api.putDisplay("{\"name\":\"Series 1\"}"));
        assertFalse(display.get("live").asBoolean());
        assertEquals("Series 1", json(api.view()).get("seriesName").asText());

        ApiResponse export = api.exportSeries();
        assertEquals(ApiResponse.CSV, export.getContentType());
        assertTrue(export.getBody().startsWith("series,t_s,SensorLux:Lux"));

        assertEquals(204, api.clearSeries().getStatus());
        assertEquals(0, json(api.listSeries()).size());
    }

    @Test
    void testPutDuration_Minutes() {
        ApiResponse response = api.putDuration("{\"value\":2,\"unit\":\"minutes\"}");

        assertEquals(200, response.getStatus());
        assertEquals(120.0, fx.store.withLock(() -> fx.store.getSession().getDurationLimitSeconds()));
    }

    @Test
    void testListSensors() throws Exception {
        fx.discovery.onAnnouncement("SensorGyro", fx.clock.instant());

        assertEquals("SensorGyro", json(api.listSensors()).get(0).asText());
    }
}
