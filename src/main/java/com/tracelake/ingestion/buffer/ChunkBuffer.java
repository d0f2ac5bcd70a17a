package com.tracelake.ingestion.buffer;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates normalized events of one kind until a row or byte threshold is crossed.
 *
 * Not thread-safe: each kind's buffer is owned by the ingest reader thread.
 * {@link #takeChunk()} hands the accumulated events over and starts a fresh
 * list, so no event is ever part of two chunks.
 */
public class ChunkBuffer {

    private final EventKind kind;
    private final int rowThreshold;
    private final long byteBudget;

    private List<NormalizedEvent> events = new ArrayList<>();
    private long estimatedBytes;
    private FlushSignal pending = FlushSignal.NONE;

    /**
     * @param kind the only kind this buffer accepts
     * @param rowThreshold rows per chunk, must be positive
     * @param byteBudget estimated bytes per chunk, 0 to disable
     */
    public ChunkBuffer(EventKind kind, int rowThreshold, long byteBudget) {
        if (rowThreshold <= 0) {
            throw new IllegalArgumentException("Row threshold must be positive: " + rowThreshold);
        }
        if (byteBudget < 0) {
            throw new IllegalArgumentException("Byte budget must not be negative: " + byteBudget);
        }
        this.kind = kind;
        this.rowThreshold = rowThreshold;
        this.byteBudget = byteBudget;
    }

    /**
     * Append an event and report whether the buffer must now be drained
     */
    public FlushSignal append(NormalizedEvent event) {
        if (event.getKind() != kind) {
            throw new IllegalArgumentException("Buffer for " + kind + " cannot hold " + event.getKind());
        }
        if (pending.shouldFlush()) {
            throw new IllegalStateException("Buffer for " + kind + " must be drained before appending");
        }
        events.add(event);
        estimatedBytes += event.estimateBytes();

        if (events.size() >= rowThreshold) {
            pending = FlushSignal.ROW_THRESHOLD;
        } else if (byteBudget > 0 && estimatedBytes >= byteBudget) {
            pending = FlushSignal.BYTE_BUDGET;
        }
        return pending;
    }

    /**
     * Transfer the accumulated events to the caller and reset the buffer
     */
    public Chunk takeChunk() {
        Chunk chunk = new Chunk(kind, events, estimatedBytes, pending);
        events = new ArrayList<>();
        estimatedBytes = 0;
        pending = FlushSignal.NONE;
        return chunk;
    }

    /**
     * Final undersized chunk at end of input, or empty if nothing is buffered
     */
    public Optional<Chunk> flushPartial() {
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(takeChunk());
    }

    /**
     * Drop buffered events without emitting them (ingest abort)
     */
    public void discard() {
        events = new ArrayList<>();
        estimatedBytes = 0;
        pending = FlushSignal.NONE;
    }

    public EventKind getKind() {
        return kind;
    }

    public int size() {
        return events.size();
    }

    public long getEstimatedBytes() {
        return estimatedBytes;
    }
}
