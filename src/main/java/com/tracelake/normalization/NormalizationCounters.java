package com.tracelake.normalization;

import com.tracelake.domain.EventKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run tallies of normalizer outcomes by event kind.
 *
 * {@code processed} counts events emitted, {@code dropped} counts classified
 * lines rejected for their timestamp, {@code malformed} counts other parse
 * failures. Undecodable lines that resemble no kind and oversized lines go to
 * the unclassified bucket.
 */
public class NormalizationCounters {

    public static final String UNCLASSIFIED = "unclassified";

    private final Map<EventKind, AtomicLong> processed = new EnumMap<>(EventKind.class);
    private final Map<EventKind, AtomicLong> dropped = new EnumMap<>(EventKind.class);
    private final Map<EventKind, AtomicLong> malformed = new EnumMap<>(EventKind.class);
    private final AtomicLong unclassifiedMalformed = new AtomicLong();

    public NormalizationCounters() {
        for (EventKind kind : EventKind.values()) {
            processed.put(kind, new AtomicLong());
            dropped.put(kind, new AtomicLong());
            malformed.put(kind, new AtomicLong());
        }
    }

    public void recordProcessed(EventKind kind) {
        processed.get(kind).incrementAndGet();
    }

    public void recordDropped(EventKind kind) {
        dropped.get(kind).incrementAndGet();
    }

    /**
     * @param kind the kind the line resembled, or null when unclassified
     */
    public void recordMalformed(EventKind kind) {
        if (kind == null) {
            unclassifiedMalformed.incrementAndGet();
        } else {
            malformed.get(kind).incrementAndGet();
        }
    }

    public long getProcessed(EventKind kind) {
        return processed.get(kind).get();
    }

    public long getDropped(EventKind kind) {
        return dropped.get(kind).get();
    }

    public long getMalformed(EventKind kind) {
        return malformed.get(kind).get();
    }

    public long getUnclassifiedMalformed() {
        return unclassifiedMalformed.get();
    }

    public long totalProcessed() {
        long total = 0;
        for (AtomicLong value : processed.values()) {
            total += value.get();
        }
        return total;
    }

    public long totalDropped() {
        long total = 0;
        for (AtomicLong value : dropped.values()) {
            total += value.get();
        }
        return total;
    }

    /**
     * Malformed lines of every kind plus unclassified ones
     */
    public long parseErrors() {
        long total = unclassifiedMalformed.get();
        for (AtomicLong value : malformed.values()) {
            total += value.get();
        }
        return total;
    }

    /**
     * Snapshot keyed by kind directory name, as stored in the manifest
     */
    public Map<String, Map<String, Long>> snapshot() {
        Map<String, Map<String, Long>> snapshot = new LinkedHashMap<>();
        for (EventKind kind : EventKind.values()) {
            Map<String, Long> counts = new LinkedHashMap<>();
            counts.put("processed", getProcessed(kind));
            counts.put("dropped", getDropped(kind));
            counts.put("malformed", getMalformed(kind));
            snapshot.put(kind.getValue(), counts);
        }
        Map<String, Long> unclassified = new LinkedHashMap<>();
        unclassified.put("malformed", unclassifiedMalformed.get());
        snapshot.put(UNCLASSIFIED, unclassified);
        return snapshot;
    }

    @Override
    public String toString() {
        return "processed=" + totalProcessed() + ", dropped=" + totalDropped() + ", malformed=" + parseErrors();
    }
}
