package com.tracelake.normalization.parsers;

import com.tracelake.domain.EventKind;

/**
 * Exception thrown when a line that looks like a known event cannot be parsed.
 * Contains error context to help diagnose parsing issues.
 *
 * Parse failures are per-record: the normalizer counts and skips them and
 * never lets them abort an ingest.
 */
public class ParseException extends RuntimeException {

    private static final int MAX_RAW_DATA_CHARS = 256;

    private final EventKind kind;
    private final long lineNumber;
    private final String rawData;

    public ParseException(String message) {
        super(message);
        this.kind = null;
        this.lineNumber = -1;
        this.rawData = null;
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.kind = null;
        this.lineNumber = -1;
        this.rawData = null;
    }

    public ParseException(String message, EventKind kind, long lineNumber, String rawData) {
        super(message);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.rawData = truncate(rawData);
    }

    public ParseException(String message, Throwable cause, EventKind kind, long lineNumber, String rawData) {
        super(message, cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.rawData = truncate(rawData);
    }

    public EventKind getKind() {
        return kind;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getRawData() {
        return rawData;
    }

    private static String truncate(String rawData) {
        if (rawData == null || rawData.length() <= MAX_RAW_DATA_CHARS) {
            return rawData;
        }
        return rawData.substring(0, MAX_RAW_DATA_CHARS);
    }
}
