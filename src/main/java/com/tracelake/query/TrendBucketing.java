package com.tracelake.query;

/**
 * Width of the time buckets of a trend query
 */
public enum TrendBucketing {
    MINUTE("minute", 60),
    FIVE_MINUTES("5m", 300),
    HOUR("hour", 3600),
    DAY("day", 86400);

    private final String value;
    private final long seconds;

    TrendBucketing(String value, long seconds) {
        this.value = value;
        this.seconds = seconds;
    }

    public String getValue() {
        return value;
    }

    public long getSeconds() {
        return seconds;
    }

    /**
     * Start of the bucket holding the given epoch second
     */
    public long bucketStart(long epochSeconds) {
        return Math.floorDiv(epochSeconds, seconds) * seconds;
    }

    public static TrendBucketing fromValue(String value) {
        for (TrendBucketing bucketing : values()) {
            if (bucketing.value.equalsIgnoreCase(value) || bucketing.name().equalsIgnoreCase(value)) {
                return bucketing;
            }
        }
        throw new InvalidFilterException("Unknown trend bucketing: " + value, "bucketing");
    }
}
