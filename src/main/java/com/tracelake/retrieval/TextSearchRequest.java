package com.tracelake.retrieval;

import com.tracelake.query.TimeRange;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A substring or regular expression searched for in the raw lines of the
 * registered sources.
 *
 * The time range applies to lines whose {@code t.$date} can be read; lines
 * without a readable timestamp are kept.
 */
public class TextSearchRequest {

    public static final int DEFAULT_LIMIT = 100;

    private final String text;
    private final String regex;
    private final boolean caseSensitive;
    private final TimeRange timeRange;
    private final int limit;

    private TextSearchRequest(Builder builder) {
        this.text = builder.text;
        this.regex = builder.regex;
        this.caseSensitive = builder.caseSensitive;
        this.timeRange = builder.timeRange;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TextSearchRequest forText(String text) {
        return builder().text(text).build();
    }

    /**
     * Line predicate of this request
     *
     * @throws IllegalArgumentException if neither text nor regex is set, the regex is invalid or the limit is not positive
     */
    LineMatcher matcher() {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
        if (timeRange != null && timeRange.isInverted()) {
            throw new IllegalArgumentException("Time range start is after its end: " + timeRange);
        }
        if (regex != null && !regex.isEmpty()) {
            try {
                Pattern pattern = Pattern.compile(regex, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                return line -> pattern.matcher(line).find();
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid search pattern: " + e.getDescription(), e);
            }
        }
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Search text or pattern is required");
        }
        if (caseSensitive) {
            return line -> line.contains(text);
        }
        String needle = text.toLowerCase();
        return line -> line.toLowerCase().contains(needle);
    }

    public String getText() {
        return text;
    }

    public String getRegex() {
        return regex;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "TextSearchRequest{" + (regex != null ? "regex=" + regex : "text=" + text)
            + ", caseSensitive=" + caseSensitive + ", timeRange=" + timeRange + ", limit=" + limit + "}";
    }

    interface LineMatcher {
        boolean matches(String line);
    }

    public static class Builder {
        private String text;
        private String regex;
        private boolean caseSensitive;
        private TimeRange timeRange;
        private int limit = DEFAULT_LIMIT;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        /**
         * Takes precedence over {@link #text(String)}
         */
        public Builder regex(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public TextSearchRequest build() {
            return new TextSearchRequest(this);
        }
    }
}
