package com.qqsuccubus.telemetry.core.model;

/**
 * Lifecycle of a measurement session.
 * <pre>
 * IDLE --start--> RUNNING --stop / duration reached--> STOPPED --start--> RUNNING
 * RUNNING | STOPPED --save--> IDLE
 * </pre>
 */
public enum SessionState {
    IDLE,
    RUNNING,
    STOPPED
}
