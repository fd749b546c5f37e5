package com.telcobright.searchagg.query;

import com.telcobright.searchagg.stats.MeasureAggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Group-by aggregation: bucket by the given columns and compute measures per bucket.
 */
public class GroupByRequest {

    private final String aggName;
    private final List<String> groupByColumns;
    private final List<MeasureAggregator> measureOperations;
    private final int bucketCount;

    public GroupByRequest(String aggName, List<String> groupByColumns,
                          List<MeasureAggregator> measureOperations, int bucketCount) {
        if (aggName == null || aggName.trim().isEmpty()) {
            throw new IllegalArgumentException("Group-by aggregation name cannot be null or empty");
        }
        if (groupByColumns == null || groupByColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one group-by column is required");
        }
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucketCount must be positive");
        }
        this.aggName = aggName;
        this.groupByColumns = Collections.unmodifiableList(new ArrayList<>(groupByColumns));
        this.measureOperations = measureOperations == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(measureOperations));
        this.bucketCount = bucketCount;
    }

    public String getAggName() {
        return aggName;
    }

    public List<String> getGroupByColumns() {
        return groupByColumns;
    }

    public List<MeasureAggregator> getMeasureOperations() {
        return measureOperations;
    }

    /**
     * Number of distinct buckets after which a group-by query stops scanning.
     */
    public int getBucketCount() {
        return bucketCount;
    }
}
