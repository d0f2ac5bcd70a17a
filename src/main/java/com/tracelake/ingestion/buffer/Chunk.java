package com.tracelake.ingestion.buffer;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;

import java.util.Collections;
import java.util.List;

/**
 * Ordered batch of events of a single kind, handed from the buffer to one writer call.
 */
public class Chunk {

    private final EventKind kind;
    private final List<NormalizedEvent> events;
    private final long estimatedBytes;
    private final FlushSignal reason;

    public Chunk(EventKind kind, List<NormalizedEvent> events, long estimatedBytes, FlushSignal reason) {
        this.kind = kind;
        this.events = Collections.unmodifiableList(events);
        this.estimatedBytes = estimatedBytes;
        this.reason = reason;
    }

    public EventKind getKind() {
        return kind;
    }

    public List<NormalizedEvent> getEvents() {
        return events;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public long getEstimatedBytes() {
        return estimatedBytes;
    }

    /**
     * Why the chunk was cut; {@link FlushSignal#NONE} for the final partial chunk
     */
    public FlushSignal getReason() {
        return reason;
    }

    public NormalizedEvent first() {
        return events.get(0);
    }
}
