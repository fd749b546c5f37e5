package com.telcobright.searchagg.results;

import com.telcobright.searchagg.bucket.BucketContribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one segment search produced: matched records, the total number of matches
 * and its contributions to the time histogram and group-by buckets.
 */
public class SegmentPartialResult {
    private final List<RecordResult> records;
    private final List<BucketContribution> timeBuckets;
    private final List<BucketContribution> groupByBuckets;
    private long matchedCount;

    public SegmentPartialResult() {
        this.records = new ArrayList<>();
        this.timeBuckets = new ArrayList<>();
        this.groupByBuckets = new ArrayList<>();
    }

    public SegmentPartialResult addRecord(RecordResult record) {
        records.add(record);
        return this;
    }

    public SegmentPartialResult addTimeBucket(BucketContribution contribution) {
        timeBuckets.add(contribution);
        return this;
    }

    public SegmentPartialResult addGroupByBucket(BucketContribution contribution) {
        groupByBuckets.add(contribution);
        return this;
    }

    /**
     * Total records matched in the segment; may exceed the number of records carried.
     */
    public SegmentPartialResult setMatchedCount(long matchedCount) {
        if (matchedCount < 0) {
            throw new IllegalArgumentException("matchedCount cannot be negative");
        }
        this.matchedCount = matchedCount;
        return this;
    }

    public List<RecordResult> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public List<BucketContribution> getTimeBuckets() {
        return Collections.unmodifiableList(timeBuckets);
    }

    public List<BucketContribution> getGroupByBuckets() {
        return Collections.unmodifiableList(groupByBuckets);
    }

    public long getMatchedCount() {
        return matchedCount;
    }

    @Override
    public String toString() {
        return "SegmentPartialResult{records=" + records.size() + ", matched=" + matchedCount
            + ", timeBuckets=" + timeBuckets.size() + ", groupByBuckets=" + groupByBuckets.size() + '}';
    }
}
