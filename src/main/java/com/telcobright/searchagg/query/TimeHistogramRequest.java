package com.telcobright.searchagg.query;

/**
 * Date histogram over the record timestamp.
 */
public class TimeHistogramRequest {

    private final String aggName;
    private final long intervalMs;

    public TimeHistogramRequest(String aggName, long intervalMs) {
        if (aggName == null || aggName.trim().isEmpty()) {
            throw new IllegalArgumentException("Time histogram aggregation name cannot be null or empty");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Time histogram interval must be positive");
        }
        this.aggName = aggName;
        this.intervalMs = intervalMs;
    }

    public String getAggName() {
        return aggName;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    /**
     * Start of the bucket holding {@code timestampMs}.
     */
    public long bucketStart(long timestampMs) {
        return Math.floorDiv(timestampMs, intervalMs) * intervalMs;
    }
}
