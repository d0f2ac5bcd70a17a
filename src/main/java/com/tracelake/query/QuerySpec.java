package com.tracelake.query;

import com.tracelake.domain.EventKind;

/**
 * A validated analytics request: shape, kind, grouping, filters and limit or bucketing
 */
public class QuerySpec {

    public static final int MAX_LIMIT = 10_000;

    private final QueryShape shape;
    private final EventKind kind;
    private final Grouping grouping;
    private final QueryFilters filters;
    private final int limit;
    private final TrendBucketing bucketing;
    private final boolean withPercentiles;

    private QuerySpec(QueryShape shape, EventKind kind, Grouping grouping, QueryFilters filters,
                      int limit, TrendBucketing bucketing, boolean withPercentiles) {
        this.shape = shape;
        this.kind = kind;
        this.grouping = grouping;
        this.filters = filters == null ? QueryFilters.none() : filters;
        this.limit = limit;
        this.bucketing = bucketing;
        this.withPercentiles = withPercentiles;
    }

    public static QuerySpec aggregate(EventKind kind, Grouping grouping, QueryFilters filters,
                                      int limit, boolean withPercentiles) {
        return new QuerySpec(QueryShape.AGGREGATE, kind, grouping, filters, limit, null, withPercentiles);
    }

    /**
     * @param grouping optional; null yields one series
     */
    public static QuerySpec trend(EventKind kind, Grouping grouping, QueryFilters filters, TrendBucketing bucketing) {
        return new QuerySpec(QueryShape.TREND, kind, grouping, filters, 0, bucketing, false);
    }

    public static QuerySpec search(EventKind kind, QueryFilters filters, int limit) {
        return new QuerySpec(QueryShape.SEARCH, kind, null, filters, limit, null, false);
    }

    /**
     * @throws InvalidFilterException on an unsupported filter, grouping or limit
     */
    public void validate() {
        if (kind == null) {
            throw new InvalidFilterException("Event kind is required", "kind");
        }
        switch (shape) {
            case AGGREGATE -> {
                if (grouping == null) {
                    throw new InvalidFilterException("Aggregate queries need a grouping", "grouping");
                }
                checkLimit();
            }
            case TREND -> {
                if (bucketing == null) {
                    throw new InvalidFilterException("Trend queries need a bucketing", "bucketing");
                }
            }
            case SEARCH -> checkLimit();
        }
        if (grouping != null && !grouping.supports(kind)) {
            throw new InvalidFilterException(
                "Grouping " + grouping.getValue() + " is not supported for " + kind.getValue(), "grouping");
        }
        if (withPercentiles && kind != EventKind.SLOW_QUERY) {
            throw new InvalidFilterException("Percentiles are only available for slow queries", "percentiles");
        }
        filters.validateFor(kind);
    }

    private void checkLimit() {
        if (limit <= 0) {
            throw new InvalidFilterException("Limit must be positive, got " + limit, "limit");
        }
        if (limit > MAX_LIMIT) {
            throw new InvalidFilterException("Limit must not exceed " + MAX_LIMIT + ", got " + limit, "limit");
        }
    }

    /**
     * Cache key of this request against one dataset version
     */
    public String cacheKey(long datasetVersion) {
        return shape
            + "|" + kind.getValue()
            + "|" + (grouping == null ? "-" : grouping.getValue())
            + "|" + filters.cacheKey()
            + "|" + limit
            + "|" + (bucketing == null ? "-" : bucketing.getValue())
            + "|" + withPercentiles
            + "|v" + datasetVersion;
    }

    public QueryShape getShape() {
        return shape;
    }

    public EventKind getKind() {
        return kind;
    }

    public Grouping getGrouping() {
        return grouping;
    }

    public QueryFilters getFilters() {
        return filters;
    }

    public int getLimit() {
        return limit;
    }

    public TrendBucketing getBucketing() {
        return bucketing;
    }

    public boolean isWithPercentiles() {
        return withPercentiles;
    }

    @Override
    public String toString() {
        return "QuerySpec{" + shape + " " + (kind == null ? null : kind.getValue())
            + ", grouping=" + grouping + ", filters=" + filters + "}";
    }
}
