package com.qqsuccubus.telemetry.station.mqtt;

import com.qqsuccubus.telemetry.station.ingest.IngestOutcome;
import com.qqsuccubus.telemetry.station.support.StationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class MessageRouterTest {

    private StationFixture fx;
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        fx = new StationFixture();
        router = fx.router;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testDiscoveryMessage_RecordsSensor() {
        router.onDiscoveryMessage("EQ1/SensorMov/data", bytes("{}"));
        router.onDiscoveryMessage("EQ1/status", bytes("{}"));
        router.onDiscoveryMessage("OTHER/SensorLux/data", bytes("{}"));

        assertEquals(Collections.singleton("SensorMov"), fx.discovery.knownSensors());
        assertEquals(1.0, fx.registry.get("telemetry.discovery.announcements.total").counter().count());
    }

    @Test
    void testDataMessage_RoutedToPipeline() {
        fx.station.setSensors(Collections.singletonList("SensorMov"));
        fx.station.start();

        IngestOutcome outcome = router.onDataMessage("EQ1/SensorMov/data",
            bytes("{\"t_ms\": 1000, \"cm\": 250, \"v_cm_s\": 10, \"a_cm_s2\": 0}"));

        assertEquals(IngestOutcome.RECORDED, outcome);
        assertEquals(2.5, fx.station.currentView().getLastValuesByMetric().get("SensorMov:dist_m"), 1e-9);
        assertEquals(1.0, fx.metrics.count(IngestOutcome.RECORDED));
    }

    @Test
    void testUndecodablePayload_DroppedAsMalformed() {
        fx.station.setSensors(Collections.singletonList("SensorLux"));

        assertEquals(IngestOutcome.MALFORMED, router.onDataMessage("EQ1/SensorLux/data", bytes("not json")));
        assertEquals(IngestOutcome.MALFORMED, router.onDataMessage("EQ1/SensorLux/data", bytes("[1,2]")));
        assertEquals(IngestOutcome.MALFORMED, router.onDataMessage("EQ1/SensorLux/data", new byte[0]));
        assertEquals(3.0, fx.metrics.count(IngestOutcome.MALFORMED));
    }

    @Test
    void testForeignTopic_Ignored() {
        assertEquals(IngestOutcome.UNSELECTED, router.onDataMessage("EQ1/SensorLux/status", bytes("{}")));
    }

    @Test
    void testReconnect_RestoresSubscriptions() {
        fx.transport.connect(router::onDataMessage, fx.selection::resubscribeAll);
        fx.station.setSensors(Collections.singletonList("SensorLux"));
        fx.transport.reset();

        fx.transport.reconnect();

        assertEquals(Collections.singletonList("EQ1/SensorLux/data"), fx.transport.subscribed);
    }

    @Test
    void testDeliveredThroughTransport() {
        fx.transport.connect(router::onDataMessage, fx.selection::resubscribeAll);
        fx.station.setSensors(Collections.singletonList("SensorLux"));

        fx.transport.deliver("EQ1/SensorLux/data", "{\"t_ms\": 5, \"Lux\": 300}");

        assertEquals(300.0, fx.station.currentView().getLastValuesByMetric().get("SensorLux:Lux"));
    }
}
