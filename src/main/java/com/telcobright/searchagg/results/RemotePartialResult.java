package com.telcobright.searchagg.results;

import com.telcobright.searchagg.bucket.BucketContribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A peer node's partial result. Raw logs are positional: {@code rawLogs.get(i)} is the payload
 * of {@code records.get(i)}.
 */
public class RemotePartialResult {

    private final List<RecordResult> records;
    private final List<Map<String, Object>> rawLogs;
    private final Set<String> columns;
    private final List<BucketContribution> timeBuckets;
    private final List<BucketContribution> groupByBuckets;
    private final long count;
    private final boolean earlyExit;

    private RemotePartialResult(Builder builder) {
        this.records = Collections.unmodifiableList(new ArrayList<>(builder.records));
        this.rawLogs = Collections.unmodifiableList(new ArrayList<>(builder.rawLogs));
        this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.columns));
        this.timeBuckets = Collections.unmodifiableList(new ArrayList<>(builder.timeBuckets));
        this.groupByBuckets = Collections.unmodifiableList(new ArrayList<>(builder.groupByBuckets));
        this.count = builder.count;
        this.earlyExit = builder.earlyExit;
    }

    public List<RecordResult> getRecords() {
        return records;
    }

    public List<Map<String, Object>> getRawLogs() {
        return rawLogs;
    }

    public Set<String> getColumns() {
        return columns;
    }

    public List<BucketContribution> getTimeBuckets() {
        return timeBuckets;
    }

    public List<BucketContribution> getGroupByBuckets() {
        return groupByBuckets;
    }

    /**
     * Records the peer matched in total.
     */
    public long getCount() {
        return count;
    }

    /**
     * Whether the peer stopped scanning before exhausting its segments.
     */
    public boolean isEarlyExit() {
        return earlyExit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<RecordResult> records = new ArrayList<>();
        private final List<Map<String, Object>> rawLogs = new ArrayList<>();
        private final Set<String> columns = new LinkedHashSet<>();
        private final List<BucketContribution> timeBuckets = new ArrayList<>();
        private final List<BucketContribution> groupByBuckets = new ArrayList<>();
        private long count;
        private boolean earlyExit;

        /**
         * Adds a record together with its raw payload.
         */
        public Builder record(RecordResult record, Map<String, Object> rawLog) {
            this.records.add(record);
            this.rawLogs.add(rawLog != null ? new LinkedHashMap<>(rawLog) : null);
            return this;
        }

        public Builder columns(Set<String> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder column(String column) {
            this.columns.add(column);
            return this;
        }

        public Builder timeBucket(BucketContribution contribution) {
            this.timeBuckets.add(contribution);
            return this;
        }

        public Builder groupByBucket(BucketContribution contribution) {
            this.groupByBuckets.add(contribution);
            return this;
        }

        public Builder count(long count) {
            if (count < 0) {
                throw new IllegalArgumentException("count cannot be negative");
            }
            this.count = count;
            return this;
        }

        public Builder earlyExit(boolean earlyExit) {
            this.earlyExit = earlyExit;
            return this;
        }

        public RemotePartialResult build() {
            return new RemotePartialResult(this);
        }
    }
}
