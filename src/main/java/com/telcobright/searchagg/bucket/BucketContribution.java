package com.telcobright.searchagg.bucket;

import com.telcobright.searchagg.stats.ColumnStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One segment's (or one peer's) partial state for one bucket: how many records fell into it
 * and, per measure id, the column statistics of those records.
 */
public class BucketContribution {

    private final BucketKey key;
    private final long docCount;
    private final Map<String, ColumnStats> measureStats;

    public BucketContribution(BucketKey key, long docCount) {
        this(key, docCount, Collections.emptyMap());
    }

    public BucketContribution(BucketKey key, long docCount, Map<String, ColumnStats> measureStats) {
        if (key == null) {
            throw new IllegalArgumentException("Bucket key cannot be null");
        }
        if (docCount < 0) {
            throw new IllegalArgumentException("Bucket doc count cannot be negative");
        }
        this.key = key;
        this.docCount = docCount;
        this.measureStats = Collections.unmodifiableMap(new LinkedHashMap<>(measureStats));
    }

    public BucketKey getKey() {
        return key;
    }

    public long getDocCount() {
        return docCount;
    }

    public Map<String, ColumnStats> getMeasureStats() {
        return measureStats;
    }

    @Override
    public String toString() {
        return "BucketContribution{key=" + key + ", docCount=" + docCount + ", measures=" + measureStats.keySet() + '}';
    }
}
