package com.qqsuccubus.telemetry.station.ingest;

/**
 * What happened to one inbound sample. Only used for accounting; drops are never surfaced as errors.
 */
public enum IngestOutcome {
    /**
     * Cached and appended to the live buffers.
     */
    RECORDED(true),
    /**
     * Cached only, no session running.
     */
    CACHED(true),
    UNSELECTED(false),
    MALFORMED(false),
    MISSING_FIELD(false),
    BAD_TIMESTAMP(false);

    private final boolean accepted;

    IngestOutcome(boolean accepted) {
        this.accepted = accepted;
    }

    public boolean isAccepted() {
        return accepted;
    }
}
