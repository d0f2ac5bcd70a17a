package com.tracelake.ingestion;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Runtime status of ingestion: the phase of the current run, the last finished
 * run and a short history of recent runs.
 */
@Component
public class IngestStatusTracker {

    private static final int RECENT_LIMIT = 10;

    private volatile IngestState state = IngestState.IDLE;
    private volatile String currentIngestId;
    private volatile String currentSource;
    private volatile Instant startedAt;
    private final Deque<IngestReport> recent = new ArrayDeque<>();

    public void begin(String ingestId, String source) {
        this.currentIngestId = ingestId;
        this.currentSource = source;
        this.startedAt = Instant.now();
    }

    public void transition(IngestState next) {
        this.state = next;
    }

    /**
     * Record a finished run and return to IDLE
     */
    public void finish(IngestReport report) {
        synchronized (recent) {
            recent.addFirst(report);
            while (recent.size() > RECENT_LIMIT) {
                recent.removeLast();
            }
        }
        this.currentIngestId = null;
        this.currentSource = null;
        this.startedAt = null;
        this.state = IngestState.IDLE;
    }

    public IngestState getState() {
        return state;
    }

    public Optional<String> getCurrentIngestId() {
        return Optional.ofNullable(currentIngestId);
    }

    public Optional<String> getCurrentSource() {
        return Optional.ofNullable(currentSource);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<IngestReport> getLastIngest() {
        synchronized (recent) {
            return Optional.ofNullable(recent.peekFirst());
        }
    }

    /**
     * Up to ten most recent runs, newest first
     */
    public List<IngestReport> getRecentIngests() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}
