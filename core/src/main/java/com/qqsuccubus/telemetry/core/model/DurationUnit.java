package com.qqsuccubus.telemetry.core.model;

/**
 * Unit accepted when configuring a measurement duration limit.
 */
public enum DurationUnit {
    SECONDS(1.0),
    MINUTES(60.0);

    private final double seconds;

    DurationUnit(double seconds) {
        this.seconds = seconds;
    }

    public double toSeconds(double value) {
        return value * seconds;
    }
}
