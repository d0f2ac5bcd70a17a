package com.tracelake.query;

import com.tracelake.domain.EventKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The closed set of predicates a query may carry.
 *
 * Each filter applies to the kinds that have its column; asking for a filter
 * on a kind without that column is an {@link InvalidFilterException}.
 */
public class QueryFilters {

    /** Databases hidden by {@code excludeSystemDatabases} */
    public static final List<String> SYSTEM_DATABASES = List.of("admin", "local", "config");

    private static final QueryFilters NONE = builder().build();

    private final TimeRange timeRange;
    private final String database;
    private final String namespace;
    private final String user;
    private final String result;
    private final String event;
    private final String remoteAddress;
    private final Long minDurationMs;
    private final boolean excludeSystemDatabases;

    private QueryFilters(Builder builder) {
        this.timeRange = builder.timeRange;
        this.database = builder.database;
        this.namespace = builder.namespace;
        this.user = builder.user;
        this.result = builder.result;
        this.event = builder.event;
        this.remoteAddress = builder.remoteAddress;
        this.minDurationMs = builder.minDurationMs;
        this.excludeSystemDatabases = builder.excludeSystemDatabases;
    }

    public static QueryFilters none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws InvalidFilterException if a filter is not available for the kind or a range is inverted
     */
    public void validateFor(EventKind kind) {
        if (timeRange != null && timeRange.isInverted()) {
            throw new InvalidFilterException("Time range start is after its end: " + timeRange, "time_range");
        }
        if (minDurationMs != null && minDurationMs < 0) {
            throw new InvalidFilterException("Minimum duration must not be negative", "min_duration_ms");
        }
        require(database, "database", kind, EventKind.SLOW_QUERY, EventKind.AUTH);
        require(namespace, "namespace", kind, EventKind.SLOW_QUERY);
        require(user, "user", kind, EventKind.AUTH);
        require(result, "result", kind, EventKind.AUTH);
        require(event, "event", kind, EventKind.CONNECTION);
        require(remoteAddress, "remote_address", kind, EventKind.AUTH, EventKind.CONNECTION);
        require(minDurationMs, "min_duration_ms", kind, EventKind.SLOW_QUERY);
        if (excludeSystemDatabases) {
            require(Boolean.TRUE, "exclude_system_databases", kind, EventKind.SLOW_QUERY, EventKind.AUTH);
        }
    }

    /**
     * Column conditions of the set filters, in a fixed order
     */
    public List<Condition> conditions() {
        List<Condition> conditions = new ArrayList<>();
        if (timeRange != null) {
            conditions.add(new Condition("ts_epoch", Operator.BETWEEN,
                List.of(timeRange.getEarliest(), timeRange.getLatest())));
        }
        addEquals(conditions, "database", database);
        addEquals(conditions, "namespace", namespace);
        addEquals(conditions, "user", user);
        addEquals(conditions, "result", result);
        addEquals(conditions, "event", event);
        addEquals(conditions, "remote_address", remoteAddress);
        if (minDurationMs != null) {
            conditions.add(new Condition("duration_ms", Operator.AT_LEAST, List.of(minDurationMs)));
        }
        if (excludeSystemDatabases) {
            conditions.add(new Condition("database", Operator.NOT_IN_OR_NULL, new ArrayList<>(SYSTEM_DATABASES)));
        }
        return conditions;
    }

    /**
     * Stable textual form used in cache keys
     */
    public String cacheKey() {
        StringBuilder sb = new StringBuilder();
        for (Condition condition : conditions()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(condition.column).append(':').append(condition.operator).append(':').append(condition.values);
        }
        return sb.toString();
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public String getDatabase() {
        return database;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getUser() {
        return user;
    }

    public String getResult() {
        return result;
    }

    public String getEvent() {
        return event;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public Long getMinDurationMs() {
        return minDurationMs;
    }

    public boolean isExcludeSystemDatabases() {
        return excludeSystemDatabases;
    }

    /**
     * Equality value for a column, if one is set
     */
    public String equalityValue(String column) {
        for (Condition condition : conditions()) {
            if (condition.operator == Operator.EQUALS && condition.column.equals(column)) {
                return (String) condition.values.get(0);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "QueryFilters{" + cacheKey() + "}";
    }

    private static void addEquals(List<Condition> conditions, String column, String value) {
        if (value != null) {
            conditions.add(new Condition(column, Operator.EQUALS, List.of(value)));
        }
    }

    private static void require(Object value, String field, EventKind kind, EventKind first, EventKind... rest) {
        if (value == null) {
            return;
        }
        Set<EventKind> allowed = EnumSet.of(first, rest);
        if (!allowed.contains(kind)) {
            throw new InvalidFilterException(
                "Filter " + field + " is not supported for " + kind.getValue(), field);
        }
    }

    public enum Operator {
        EQUALS,
        AT_LEAST,
        BETWEEN,
        NOT_IN_OR_NULL
    }

    /**
     * One predicate on one column, evaluated the same way by every engine
     */
    public static final class Condition {
        private final String column;
        private final Operator operator;
        private final List<Object> values;

        Condition(String column, Operator operator, List<?> values) {
            this.column = column;
            this.operator = operator;
            this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
        }

        public String getColumn() {
            return column;
        }

        public Operator getOperator() {
            return operator;
        }

        public List<Object> getValues() {
            return values;
        }

        /**
         * Evaluate against a column value read from a row
         */
        public boolean matches(Object value) {
            switch (operator) {
                case EQUALS:
                    return value != null && value.toString().equals(values.get(0));
                case AT_LEAST:
                    return value instanceof Number && ((Number) value).longValue() >= (Long) values.get(0);
                case BETWEEN:
                    if (!(value instanceof Number)) {
                        return false;
                    }
                    long v = ((Number) value).longValue();
                    return v >= (Long) values.get(0) && v <= (Long) values.get(1);
                case NOT_IN_OR_NULL:
                    return value == null || !values.contains(value.toString());
                default:
                    throw new IllegalStateException("Unhandled operator " + operator);
            }
        }
    }

    public static class Builder {
        private TimeRange timeRange;
        private String database;
        private String namespace;
        private String user;
        private String result;
        private String event;
        private String remoteAddress;
        private Long minDurationMs;
        private boolean excludeSystemDatabases;

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder timeRange(long earliest, long latest) {
            return timeRange(new TimeRange(earliest, latest));
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder minDurationMs(Long minDurationMs) {
            this.minDurationMs = minDurationMs;
            return this;
        }

        public Builder excludeSystemDatabases(boolean excludeSystemDatabases) {
            this.excludeSystemDatabases = excludeSystemDatabases;
            return this;
        }

        public QueryFilters build() {
            return new QueryFilters(this);
        }
    }
}
