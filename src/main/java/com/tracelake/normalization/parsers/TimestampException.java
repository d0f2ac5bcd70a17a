package com.tracelake.normalization.parsers;

import com.tracelake.domain.EventKind;

/**
 * Raised when a classified event has a missing or unparsable timestamp.
 * The event is dropped and counted separately from malformed lines.
 */
public class TimestampException extends ParseException {

    private final String rawTimestamp;

    public TimestampException(String message, String rawTimestamp) {
        super(message);
        this.rawTimestamp = rawTimestamp;
    }

    public TimestampException(String message, String rawTimestamp, EventKind kind, long lineNumber, String rawData) {
        super(message, kind, lineNumber, rawData);
        this.rawTimestamp = rawTimestamp;
    }

    public String getRawTimestamp() {
        return rawTimestamp;
    }
}
