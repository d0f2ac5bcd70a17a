package com.tracelake.domain;

/**
 * One row of the offset index: where the raw line behind a record key lives.
 */
public class OffsetIndexEntry {

    private final String recordKey;
    private final long tsEpoch;
    private final RawSpan span;
    private final long lineNumber;
    private final String sample;

    public OffsetIndexEntry(String recordKey, long tsEpoch, RawSpan span, long lineNumber, String sample) {
        this.recordKey = recordKey;
        this.tsEpoch = tsEpoch;
        this.span = span;
        this.lineNumber = lineNumber;
        this.sample = sample;
    }

    public static OffsetIndexEntry of(NormalizedEvent event) {
        return new OffsetIndexEntry(
            event.getRecordKey(),
            event.getTsEpoch(),
            event.getSpan(),
            event.getLineNumber(),
            event.getSample()
        );
    }

    public String getRecordKey() {
        return recordKey;
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

    @Override
    public String toString() {
        return "OffsetIndexEntry{recordKey=" + recordKey + ", tsEpoch=" + tsEpoch + ", " + span + "}";
    }
}
