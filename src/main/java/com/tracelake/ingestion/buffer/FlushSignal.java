package com.tracelake.ingestion.buffer;

/**
 * Outcome of appending to a {@link ChunkBuffer}.
 */
public enum FlushSignal {

    /**
     * Keep appending
     */
    NONE,

    /**
     * Row threshold reached; the caller must take the chunk
     */
    ROW_THRESHOLD,

    /**
     * Byte budget reached; the caller must take the chunk
     */
    BYTE_BUDGET;

    public boolean shouldFlush() {
        return this != NONE;
    }
}
