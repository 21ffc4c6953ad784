package com.qqsuccubus.telemetry.station.control;

import com.qqsuccubus.telemetry.core.model.SessionState;
import com.qqsuccubus.telemetry.core.model.TelemetryView;
import com.qqsuccubus.telemetry.station.support.StationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryStationTest {

    private StationFixture fx;
    private ITelemetryStation station;

    @BeforeEach
    void setUp() {
        fx = new StationFixture();
        station = fx.station;
    }

    @Test
    void testListSensors_OnlyFreshAnnouncements() {
        fx.discovery.onAnnouncement("SensorMov", fx.clock.instant());
        fx.clock.advance(Duration.ofSeconds(4));
        fx.discovery.onAnnouncement("SensorLux", fx.clock.instant());
        fx.clock.advance(Duration.ofSeconds(2));

        assertEquals(Collections.singleton("SensorLux"), station.listSensors());
    }

    @Test
    void testEndToEnd_RecordSaveDisplay() {
        station.setSensors(Collections.singletonList("SensorMov"));
        station.start();
        fx.mov(0, 100);
        fx.mov(250, 150);
        station.save();
        station.selectForDisplay("Series 1");

        TelemetryView view = station.currentView();
        assertEquals("Series 1", view.getSeriesName());
        assertEquals(Arrays.asList(0.0, 0.25), view.getTimes());
        assertEquals(Collections.singletonList("Series 1"), station.listSnapshotNames());
        assertEquals(SessionState.IDLE, station.sessionState());
    }

    @Test
    void testConcurrentIngestAndReads_EqualLengthViews() throws Exception {
        station.setSensors(Arrays.asList("SensorMov", "SensorLux"));
        station.start();

        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        futures.add(pool.submit(() -> {
            go.await();
            for (int i = 0; i < 500; i++) {
                fx.mov(i, i);
            }
            return null;
        }));
        futures.add(pool.submit(() -> {
            go.await();
            for (int i = 0; i < 500; i++) {
                fx.lux(i, i);
            }
            return null;
        }));
        futures.add(pool.submit(() -> {
            go.await();
            for (int i = 0; i < 500; i++) {
                TelemetryView view = station.currentView();
                int size = view.getTimes().size();
                view.getValuesByMetric().values().forEach(values -> assertEquals(size, values.size()));
            }
            return null;
        }));

        go.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(fx.config.bufferCapacity(), station.currentView().getTimes().size());
    }
}
