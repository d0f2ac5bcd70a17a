package com.tracelake.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumeration of the event kinds recognised in a structured server log.
 * Each kind owns its own partition directory, offset index file and schema.
 */
public enum EventKind {

    /**
     * Operations reported as slow by the profiler ("Slow query" messages)
     */
    SLOW_QUERY("slow_queries", "namespace"),

    /**
     * Authentication successes and failures from the ACCESS component
     */
    AUTH("authentications", "user"),

    /**
     * Connection lifecycle events (accepted / ended)
     */
    CONNECTION("connections", "remote_address");

    private final String value;
    private final String pruningColumn;

    EventKind(String value, String pruningColumn) {
        this.value = value;
        this.pruningColumn = pruningColumn;
    }

    /**
     * Directory name under the dataset root, also used as the manifest key
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * String column whose min/max statistics are recorded per partition
     */
    public String getPruningColumn() {
        return pruningColumn;
    }

    /**
     * Parse a string value to EventKind, accepting both the directory name and the enum name
     */
    public static EventKind fromValue(String value) {
        for (EventKind kind : EventKind.values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown EventKind value: " + value);
    }
}
