package com.telcobright.searchagg.results;

import com.google.common.collect.Range;

import java.util.Objects;

/**
 * What the early-exit rules need to know about a segment before it is searched.
 */
public class SegmentCandidate {

    private final Range<Long> timeRange;
    private final SearchNodeType nodeType;
    private final boolean otherAggsPresent;
    private final boolean timeAggsPresent;

    public SegmentCandidate(Range<Long> timeRange, SearchNodeType nodeType,
                            boolean otherAggsPresent, boolean timeAggsPresent) {
        Objects.requireNonNull(timeRange, "timeRange");
        if (!timeRange.hasLowerBound() || !timeRange.hasUpperBound()) {
            throw new IllegalArgumentException("Segment time range must be bounded: " + timeRange);
        }
        this.timeRange = timeRange;
        this.nodeType = Objects.requireNonNull(nodeType, "nodeType");
        this.otherAggsPresent = otherAggsPresent;
        this.timeAggsPresent = timeAggsPresent;
    }

    public static SegmentCandidate of(long startEpochMs, long endEpochMs, SearchNodeType nodeType,
                                      boolean otherAggsPresent, boolean timeAggsPresent) {
        return new SegmentCandidate(Range.closed(startEpochMs, endEpochMs), nodeType,
            otherAggsPresent, timeAggsPresent);
    }

    public Range<Long> getTimeRange() {
        return timeRange;
    }

    public long getStartEpochMs() {
        return timeRange.lowerEndpoint();
    }

    public long getEndEpochMs() {
        return timeRange.upperEndpoint();
    }

    public SearchNodeType getNodeType() {
        return nodeType;
    }

    public boolean isMatchAll() {
        return nodeType == SearchNodeType.MATCH_ALL;
    }

    /**
     * Whether aggregations other than the time histogram are structurally present.
     */
    public boolean isOtherAggsPresent() {
        return otherAggsPresent;
    }

    public boolean isTimeAggsPresent() {
        return timeAggsPresent;
    }

    @Override
    public String toString() {
        return "SegmentCandidate{range=" + timeRange + ", node=" + nodeType
            + ", otherAggs=" + otherAggsPresent + ", timeAggs=" + timeAggsPresent + '}';
    }
}
