package com.qqsuccubus.telemetry.station.control;

import com.qqsuccubus.telemetry.core.model.DurationUnit;
import com.qqsuccubus.telemetry.core.model.SeriesSnapshot;
import com.qqsuccubus.telemetry.core.model.SessionState;
import com.qqsuccubus.telemetry.core.model.TelemetryView;
import com.qqsuccubus.telemetry.station.selection.ChannelState;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Operations offered to the presentation layer (Dependency Inversion Principle).
 * <p>
 * Reads are consistent copies; mutators take effect on the next sample or refresh tick and never
 * preempt in-flight work.
 * </p>
 */
public interface ITelemetryStation {

    /**
     * @return Either the live buffers or the displayed saved series
     */
    TelemetryView currentView();

    /**
     * @return Sensors announcing within the staleness window, sorted
     */
    Set<String> listSensors();

    List<String> listSnapshotNames();

    List<SeriesSnapshot> snapshots();

    List<String> selectedSensors();

    List<ChannelState> channelsFor(String sensorId);

    void setSensors(List<String> sensorIds);

    /**
     * @throws com.qqsuccubus.telemetry.core.error.InvalidSelectionException if the sensor would be left without metrics
     */
    void setChannels(String sensorId, Collection<String> metricIds);

    void start();

    void stop();

    /**
     * @throws com.qqsuccubus.telemetry.core.error.EmptyRecordingException if nothing was recorded
     */
    SeriesSnapshot save();

    void clearAll();

    void configureDuration(double value, DurationUnit unit);

    boolean selectForDisplay(String seriesName);

    SessionState sessionState();
}
