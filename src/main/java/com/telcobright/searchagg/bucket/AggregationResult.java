package com.telcobright.searchagg.bucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All buckets of one named aggregation (a time histogram or a group-by).
 */
public class AggregationResult {

    private final String name;
    private final boolean dateHistogram;
    private final List<BucketResult> results;

    public AggregationResult(String name, boolean dateHistogram, List<BucketResult> results) {
        this.name = name;
        this.dateHistogram = dateHistogram;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public String getName() {
        return name;
    }

    public boolean isDateHistogram() {
        return dateHistogram;
    }

    public List<BucketResult> getResults() {
        return results;
    }

    @Override
    public String toString() {
        return "AggregationResult{name=" + name + ", buckets=" + results.size() + '}';
    }
}
