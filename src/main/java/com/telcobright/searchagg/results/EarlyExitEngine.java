package com.telcobright.searchagg.results;

import com.telcobright.searchagg.query.QueryAggregators;
import com.telcobright.searchagg.query.QueryType;

/**
 * Decides whether a segment or a time span can still change a query's answer.
 *
 * Holds only the query's fixed shape; running counters and the top-K are passed in by the
 * controller, which calls this under its lock.
 */
public class EarlyExitEngine {

    private final QueryType queryType;
    private final QueryAggregators aggregators;

    public EarlyExitEngine(QueryType queryType, QueryAggregators aggregators) {
        this.queryType = queryType;
        this.aggregators = aggregators;
    }

    /**
     * Classifies a candidate segment. Rules are evaluated in order; the first match wins.
     *
     * @param resultCount records matched so far
     * @param sizeLimit   records the query returns
     * @param numBuckets  distinct buckets seen so far
     * @param merger      the query's top-K, consulted for sort admissibility
     */
    public EarlyExitType classify(long resultCount, long sizeLimit, int numBuckets,
                                  BoundedResultMerger merger, SegmentCandidate candidate) {
        // not enough records yet
        if (resultCount <= sizeLimit) {
            return EarlyExitType.CONTINUE_SCAN;
        }

        if (queryType == QueryType.GROUP_BY) {
            return numBuckets < aggregators.getGroupByRequest().getBucketCount()
                ? EarlyExitType.CONTINUE_SCAN
                : EarlyExitType.SKIP_ENTIRELY;
        }
        if (queryType != QueryType.RAW_RECORD) {
            return EarlyExitType.CONTINUE_SCAN;
        }

        // could a record from this segment still displace a retained one?
        if (aggregators != null && aggregators.getSort() != null) {
            long boundary = aggregators.getSort().isAscending()
                ? candidate.getStartEpochMs()
                : candidate.getEndEpochMs();
            if (merger.willValueBeAdded(boundary)) {
                return EarlyExitType.CONTINUE_SCAN;
            }
        }

        // records are complete; a match-all segment only feeds the histogram
        if (candidate.isMatchAll() && candidate.isTimeAggsPresent() && !candidate.isOtherAggsPresent()) {
            return EarlyExitType.AGGREGATES_ONLY;
        }
        if (!candidate.isMatchAll() && (candidate.isTimeAggsPresent() || candidate.isOtherAggsPresent())) {
            return EarlyExitType.CONTINUE_SCAN;
        }

        if (aggregators == null) {
            return EarlyExitType.SKIP_ENTIRELY;
        }
        if (!aggregators.isEarlyExit()) {
            return EarlyExitType.CONTINUE_SCAN;
        }
        if (aggregators.getTimeHistogram() != null || aggregators.getGroupByRequest() != null) {
            return EarlyExitType.CONTINUE_SCAN;
        }
        return EarlyExitType.SKIP_ENTIRELY;
    }

    /**
     * Whether a whole time span must be searched. Spans are always searched when early exit is
     * disabled for the query: no aggregators, early exit turned off, or a time histogram.
     */
    public boolean shouldSearchTimeRange(long resultCount, long sizeLimit, BoundedResultMerger merger,
                                         long lowTs, long highTs) {
        if (queryType != QueryType.RAW_RECORD) {
            return true;
        }
        if (resultCount <= sizeLimit) {
            return true;
        }
        if (aggregators == null || !aggregators.isEarlyExit() || aggregators.getTimeHistogram() != null) {
            return true;
        }
        if (aggregators.getSort() != null) {
            return merger.willValueBeAdded(aggregators.getSort().isAscending() ? lowTs : highTs);
        }
        return false;
    }
}
