package com.qqsuccubus.telemetry.station.tick;

import com.qqsuccubus.telemetry.station.discovery.IDiscoveryTracker;
import com.qqsuccubus.telemetry.station.session.SessionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;

/**
 * The periodic read context: on every tick, enforce the session duration limit and evict
 * sensors that stopped announcing (which drops them from the selection).
 */
public class RefreshTicker {
    private static final Logger log = LoggerFactory.getLogger(RefreshTicker.class);

    private final SessionController sessionController;
    private final IDiscoveryTracker discoveryTracker;
    private final Clock clock;
    private final Duration interval;
    private final Duration sensorStaleAfter;

    public RefreshTicker(SessionController sessionController,
                         IDiscoveryTracker discoveryTracker,
                         Clock clock,
                         Duration interval,
                         Duration sensorStaleAfter) {
        this.sessionController = sessionController;
        this.discoveryTracker = discoveryTracker;
        this.clock = clock;
        this.interval = interval;
        this.sensorStaleAfter = sensorStaleAfter;
    }

    public Disposable start() {
        log.info("Refresh ticker running every {} ms", interval.toMillis());
        return Flux.interval(interval, interval)
            .onBackpressureDrop()
            .subscribe(tick -> tick(), err -> log.error("Refresh ticker terminated", err));
    }

    /**
     * One refresh step. Failures are logged so a single bad tick does not end the ticker.
     */
    public void tick() {
        try {
            sessionController.checkAutoStop();
            discoveryTracker.activeSensors(clock.instant(), sensorStaleAfter);
        } catch (RuntimeException e) {
            log.error("Refresh tick failed", e);
        }
    }
}
