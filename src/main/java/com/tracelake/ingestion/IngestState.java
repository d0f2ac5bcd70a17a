package com.tracelake.ingestion;

/**
 * Phases of an ingest run.
 *
 * A successful run goes IDLE, LOCKED, PARSING, FLUSHING, PUBLISHING and back
 * to IDLE; a failed one leaves through ABORTING. Only the end of PUBLISHING is
 * visible to readers.
 */
public enum IngestState {
    IDLE,
    LOCKED,
    PARSING,
    FLUSHING,
    PUBLISHING,
    ABORTING;

    /**
     * States from which a cancel request is honored
     */
    public boolean isCancellable() {
        return this == PARSING || this == FLUSHING || this == PUBLISHING;
    }
}
