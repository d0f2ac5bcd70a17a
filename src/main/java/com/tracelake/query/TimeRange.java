package com.tracelake.query;

/**
 * Represents an inclusive time range in epoch seconds for query filtering
 */
public class TimeRange {
    private final long earliest;
    private final long latest;

    public TimeRange(long earliest, long latest) {
        this.earliest = earliest;
        this.latest = latest;
    }

    public long getEarliest() {
        return earliest;
    }

    public long getLatest() {
        return latest;
    }

    public boolean isInverted() {
        return earliest > latest;
    }

    public boolean contains(long epochSeconds) {
        return epochSeconds >= earliest && epochSeconds <= latest;
    }

    /**
     * Whether any second of [min, max] falls inside this range
     */
    public boolean overlaps(long min, long max) {
        return max >= earliest && min <= latest;
    }

    @Override
    public String toString() {
        return earliest + ".." + latest;
    }
}
