package com.tracelake.query;

import com.tracelake.domain.EventKind;

/**
 * Column names of query result rows, shared by all engines.
 *
 * Aggregates rank by {@link #rankColumn(EventKind)} descending, then by group
 * ascending. Trends are ordered by bucket, then group. Searches return the
 * newest rows first, ties broken by record key.
 */
public final class ResultColumns {

    public static final String GROUP = "group";
    public static final String BUCKET = "bucket";
    public static final String COUNT = "count";

    public static final String TOTAL_DURATION_MS = "total_duration_ms";
    public static final String AVG_DURATION_MS = "avg_duration_ms";
    public static final String MAX_DURATION_MS = "max_duration_ms";
    public static final String P95_DURATION_MS = "p95_duration_ms";
    public static final String TOTAL_DOCS_EXAMINED = "total_docs_examined";
    public static final String TOTAL_DOCS_RETURNED = "total_docs_returned";
    public static final String TOTAL_KEYS_EXAMINED = "total_keys_examined";

    public static final String FAILURES = "failures";
    public static final String SUCCESSES = "successes";

    public static final String ACCEPTED = "accepted";
    public static final String ENDED = "ended";

    private ResultColumns() {
    }

    public static String rankColumn(EventKind kind) {
        return switch (kind) {
            case SLOW_QUERY -> TOTAL_DURATION_MS;
            case AUTH, CONNECTION -> COUNT;
        };
    }
}
