package com.qqsuccubus.telemetry.station.control;

import com.qqsuccubus.telemetry.core.model.DurationUnit;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import com.qqsuccubus.telemetry.core.model.SessionState;
import com.qqsuccubus.telemetry.core.model.TelemetryView;
import com.qqsuccubus.telemetry.station.discovery.IDiscoveryTracker;
import com.qqsuccubus.telemetry.station.selection.ChannelState;
import com.qqsuccubus.telemetry.station.selection.SelectionManager;
import com.qqsuccubus.telemetry.station.session.SessionController;
import com.qqsuccubus.telemetry.station.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Presentation-facing facade over the state engine components.
 */
@RequiredArgsConstructor
public class TelemetryStation implements ITelemetryStation {

    private final IDiscoveryTracker discoveryTracker;
    private final SelectionManager selectionManager;
    private final SessionController sessionController;
    private final SnapshotStore snapshotStore;
    private final Clock clock;
    private final Duration sensorStaleAfter;

    @Override
    public TelemetryView currentView() {
        return snapshotStore.currentView();
    }

    @Override
    public Set<String> listSensors() {
        return discoveryTracker.activeSensors(clock.instant(), sensorStaleAfter);
    }

    @Override
    public List<String> listSnapshotNames() {
        return snapshotStore.names();
    }

    @Override
    public List<SeriesSnapshot> snapshots() {
        return snapshotStore.snapshots();
    }

    @Override
    public List<String> selectedSensors() {
        return selectionManager.selectedSensors();
    }

    @Override
    public List<ChannelState> channelsFor(String sensorId) {
        return selectionManager.channelsFor(sensorId);
    }

    @Override
    public void setSensors(List<String> sensorIds) {
        selectionManager.setSensors(sensorIds);
    }

    @Override
    public void setChannels(String sensorId, Collection<String> metricIds) {
        selectionManager.setChannels(sensorId, metricIds);
    }

    @Override
    public void start() {
        sessionController.start();
    }

    @Override
    public void stop() {
        sessionController.stop();
    }

    @Override
    public SeriesSnapshot save() {
        return sessionController.save();
    }

    @Override
    public void clearAll() {
        snapshotStore.clearAll();
    }

    @Override
    public void configureDuration(double value, DurationUnit unit) {
        sessionController.configureDuration(value, unit);
    }

    @Override
    public boolean selectForDisplay(String seriesName) {
        return snapshotStore.selectForDisplay(seriesName);
    }

    @Override
    public SessionState sessionState() {
        return sessionController.state();
    }
}
