package com.tracelake.domain;

/**
 * Base type of every typed record produced by the normalizer.
 *
 * Subclasses are fixed by {@link EventKind}; consumers dispatch with an
 * exhaustive switch over {@link #getKind()} rather than probing fields.
 * Events are immutable once built and carry the {@link RawSpan} of the line
 * they were parsed from.
 */
public abstract class NormalizedEvent {

    private final String recordKey;
    private final String timestamp;
    private final long tsEpoch;
    private final RawSpan span;
    private final long lineNumber;
    private final String sample;

    protected NormalizedEvent(String recordKey, String timestamp, long tsEpoch,
                              RawSpan span, long lineNumber, String sample) {
        this.recordKey = recordKey;
        this.timestamp = timestamp;
        this.tsEpoch = tsEpoch;
        this.span = span;
        this.lineNumber = lineNumber;
        this.sample = sample;
    }

    public abstract EventKind getKind();

    /**
     * Rough in-memory size used by the chunk buffer's byte budget
     */
    public abstract long estimateBytes();

    public String getRecordKey() {
        return recordKey;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public long getTsEpoch() {
        return tsEpoch;
    }

    public RawSpan getSpan() {
        return span;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getSample() {
        return sample;
    }

    protected long baseEstimate() {
        return 64 + size(recordKey) + size(timestamp) + size(sample);
    }

    protected static long size(String value) {
        return value == null ? 0 : 2L * value.length();
    }
}
