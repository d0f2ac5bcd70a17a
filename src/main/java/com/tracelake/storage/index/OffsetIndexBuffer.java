package com.tracelake.storage.index;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.NormalizedEvent;
import com.tracelake.domain.OffsetIndexEntry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pending offset index entries of one ingest run, per kind.
 *
 * {@link #record(NormalizedEvent)} is called for every event at the moment it
 * enters its chunk buffer, and {@link #drain(EventKind)} when that buffer is
 * drained, so a drained batch always pairs with exactly one data chunk.
 * Owned by the ingest reader thread.
 */
public class OffsetIndexBuffer {

    private final Map<EventKind, List<OffsetIndexEntry>> pending = new EnumMap<>(EventKind.class);

    public OffsetIndexBuffer() {
        for (EventKind kind : EventKind.values()) {
            pending.put(kind, new ArrayList<>());
        }
    }

    public void record(NormalizedEvent event) {
        pending.get(event.getKind()).add(OffsetIndexEntry.of(event));
    }

    /**
     * Hand over the entries recorded since the last drain of this kind
     */
    public List<OffsetIndexEntry> drain(EventKind kind) {
        List<OffsetIndexEntry> entries = pending.get(kind);
        pending.put(kind, new ArrayList<>());
        return entries;
    }

    public int size(EventKind kind) {
        return pending.get(kind).size();
    }
}
