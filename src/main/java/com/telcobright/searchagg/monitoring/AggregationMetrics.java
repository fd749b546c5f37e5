package com.telcobright.searchagg.monitoring;

import com.telcobright.searchagg.results.EarlyExitType;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one query's aggregation activity.
 */
public class AggregationMetrics {

    private final long queryId;
    private final LocalDateTime startTimestamp;

    private final AtomicLong segmentsMerged = new AtomicLong(0);
    private final AtomicLong segmentStatsMerged = new AtomicLong(0);
    private final AtomicLong remoteMerges = new AtomicLong(0);
    private final AtomicLong remoteMergeFailures = new AtomicLong(0);
    private final AtomicLong recordsEvicted = new AtomicLong(0);
    private final AtomicLong errorsRecorded = new AtomicLong(0);
    private final Map<EarlyExitType, AtomicLong> classifications = new EnumMap<>(EarlyExitType.class);

    private volatile LocalDateTime finalizedTimestamp;

    public AggregationMetrics(long queryId) {
        this.queryId = queryId;
        this.startTimestamp = LocalDateTime.now();
        for (EarlyExitType type : EarlyExitType.values()) {
            classifications.put(type, new AtomicLong(0));
        }
    }

    public long getQueryId() {
        return queryId;
    }

    public LocalDateTime getStartTimestamp() {
        return startTimestamp;
    }

    public void recordSegmentMerged() {
        segmentsMerged.incrementAndGet();
    }

    public long getSegmentsMerged() {
        return segmentsMerged.get();
    }

    public void recordSegmentStatsMerged() {
        segmentStatsMerged.incrementAndGet();
    }

    public long getSegmentStatsMerged() {
        return segmentStatsMerged.get();
    }

    public void recordRemoteMerge(boolean succeeded) {
        remoteMerges.incrementAndGet();
        if (!succeeded) {
            remoteMergeFailures.incrementAndGet();
        }
    }

    public long getRemoteMerges() {
        return remoteMerges.get();
    }

    public long getRemoteMergeFailures() {
        return remoteMergeFailures.get();
    }

    public void recordEvictions(long count) {
        recordsEvicted.addAndGet(count);
    }

    public long getRecordsEvicted() {
        return recordsEvicted.get();
    }

    public void recordErrors(long count) {
        errorsRecorded.addAndGet(count);
    }

    public long getErrorsRecorded() {
        return errorsRecorded.get();
    }

    public void recordClassification(EarlyExitType type) {
        classifications.get(type).incrementAndGet();
    }

    public long getClassificationCount(EarlyExitType type) {
        return classifications.get(type).get();
    }

    public void setFinalizedTimestamp(LocalDateTime timestamp) {
        this.finalizedTimestamp = timestamp;
    }

    public LocalDateTime getFinalizedTimestamp() {
        return finalizedTimestamp;
    }

    @Override
    public String toString() {
        return String.format(
            "AggregationMetrics{qid=%d, segments=%d, segmentStats=%d, remoteMerges=%d (failed %d), evicted=%d, errors=%d, skipped=%d}",
            queryId, getSegmentsMerged(), getSegmentStatsMerged(), getRemoteMerges(), getRemoteMergeFailures(),
            getRecordsEvicted(), getErrorsRecorded(), getClassificationCount(EarlyExitType.SKIP_ENTIRELY));
    }
}
