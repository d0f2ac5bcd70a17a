package com.tracelake.query;

import com.tracelake.domain.EventKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Group-by keys of aggregate and trend queries, with the kinds that carry them
 */
public enum Grouping {
    NAMESPACE("namespace", EventKind.SLOW_QUERY),
    DATABASE("database", EventKind.SLOW_QUERY, EventKind.AUTH),
    QUERY_HASH("query_hash", EventKind.SLOW_QUERY),
    PLAN_SUMMARY("plan_summary", EventKind.SLOW_QUERY),
    OPERATION("operation", EventKind.SLOW_QUERY),
    /** namespace, plan summary and query hash joined with {@code ::} */
    PATTERN_KEY("pattern_key", EventKind.SLOW_QUERY),
    USER("user", EventKind.AUTH),
    RESULT("result", EventKind.AUTH),
    MECHANISM("mechanism", EventKind.AUTH),
    REMOTE_ADDRESS("remote_address", EventKind.AUTH, EventKind.CONNECTION),
    EVENT("event", EventKind.CONNECTION),
    APP_NAME("app_name", EventKind.CONNECTION);

    public static final String UNKNOWN_GROUP = "unknown";
    public static final String PATTERN_SEPARATOR = "::";

    private final String value;
    private final Set<EventKind> kinds;

    Grouping(String value, EventKind first, EventKind... rest) {
        this.value = value;
        this.kinds = EnumSet.of(first, rest);
    }

    public String getValue() {
        return value;
    }

    public boolean supports(EventKind kind) {
        return kinds.contains(kind);
    }

    /**
     * True when the key is computed from several columns rather than read from one
     */
    public boolean isComposite() {
        return this == PATTERN_KEY;
    }

    /**
     * Pattern key of a slow query: the non-null parts joined with {@link #PATTERN_SEPARATOR}
     */
    public static String patternKey(String namespace, String planSummary, String queryHash) {
        List<String> parts = new ArrayList<>(3);
        for (String part : new String[] {namespace, planSummary, queryHash}) {
            if (part != null) {
                parts.add(part);
            }
        }
        return String.join(PATTERN_SEPARATOR, parts);
    }

    public static Grouping fromValue(String value) {
        for (Grouping grouping : values()) {
            if (grouping.value.equalsIgnoreCase(value) || grouping.name().equalsIgnoreCase(value)) {
                return grouping;
            }
        }
        throw new InvalidFilterException("Unknown grouping: " + value, "grouping");
    }
}
