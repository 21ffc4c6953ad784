package com.qqsuccubus.telemetry.station.state;

import com.qqsuccubus.telemetry.core.model.SessionState;
import lombok.Getter;
import lombok.Setter;

/**
 * Recording state and the sample-index-derived time axis. Guarded by the state store lock.
 */
@Getter
public class MeasurementSession {
    private SessionState state = SessionState.IDLE;
    private long sampleIndex;
    private double elapsedSeconds;

    /**
     * Recording limit in seconds, {@code null} for unbounded.
     */
    @Setter
    private Double durationLimitSeconds;

    public boolean isRunning() {
        return state == SessionState.RUNNING;
    }

    /**
     * Claims the next slot on the time axis.
     *
     * @param samplePeriodSeconds Period of the sensor that produced the sample
     * @return Time of the claimed slot: {@code sampleIndex * period} before the increment
     */
    public double advance(double samplePeriodSeconds) {
        double time = sampleIndex * samplePeriodSeconds;
        sampleIndex++;
        elapsedSeconds = sampleIndex * samplePeriodSeconds;
        return time;
    }

    public boolean isDurationReached() {
        return durationLimitSeconds != null && elapsedSeconds >= durationLimitSeconds;
    }

    void transition(SessionState next) {
        this.state = next;
    }

    public void begin() {
        rewind();
        transition(SessionState.RUNNING);
    }

    public void halt() {
        transition(SessionState.STOPPED);
    }

    public void finish() {
        rewind();
        transition(SessionState.IDLE);
    }

    /**
     * Back to IDLE with a zeroed time axis and no duration limit.
     */
    public void reset() {
        finish();
        durationLimitSeconds = null;
    }

    private void rewind() {
        sampleIndex = 0;
        elapsedSeconds = 0.0;
    }
}
