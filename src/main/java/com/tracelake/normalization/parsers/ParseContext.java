package com.tracelake.normalization.parsers;

import com.tracelake.domain.RawSpan;

/**
 * Position and provenance of the line being parsed.
 */
public class ParseContext {

    private final String line;
    private final RawSpan span;
    private final long lineNumber;
    private final String sample;

    public ParseContext(String line, RawSpan span, long lineNumber, String sample) {
        this.line = line;
        this.span = span;
        this.lineNumber = lineNumber;
        this.sample = sample;
    }

    public String getLine() {
        return line;
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
}
