package com.telcobright.searchagg.results;

import com.telcobright.searchagg.bucket.AggregationResult;
import com.telcobright.searchagg.bucket.BucketRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative result computed by a coordinator and pushed down to finalize a query.
 * A result with group-by columns carries buckets in {@code histogram}; otherwise it carries
 * exactly one measure row whose values are display strings.
 */
public class NodeResult {

    private final Map<String, AggregationResult> histogram;
    private final List<String> groupByColumns;
    private final List<String> measureFunctions;
    private final List<BucketRow> measureResults;
    private final Map<String, Integer> columnsOrder;

    private NodeResult(Builder builder) {
        this.histogram = Collections.unmodifiableMap(new LinkedHashMap<>(builder.histogram));
        this.groupByColumns = Collections.unmodifiableList(new ArrayList<>(builder.groupByColumns));
        this.measureFunctions = Collections.unmodifiableList(new ArrayList<>(builder.measureFunctions));
        this.measureResults = Collections.unmodifiableList(new ArrayList<>(builder.measureResults));
        this.columnsOrder = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columnsOrder));
    }

    public Map<String, AggregationResult> getHistogram() {
        return histogram;
    }

    public List<String> getGroupByColumns() {
        return groupByColumns;
    }

    public boolean isGroupBy() {
        return !groupByColumns.isEmpty();
    }

    public List<String> getMeasureFunctions() {
        return measureFunctions;
    }

    public List<BucketRow> getMeasureResults() {
        return measureResults;
    }

    public Map<String, Integer> getColumnsOrder() {
        return columnsOrder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, AggregationResult> histogram = new LinkedHashMap<>();
        private final List<String> groupByColumns = new ArrayList<>();
        private final List<String> measureFunctions = new ArrayList<>();
        private final List<BucketRow> measureResults = new ArrayList<>();
        private final Map<String, Integer> columnsOrder = new LinkedHashMap<>();

        public Builder aggregation(AggregationResult aggregation) {
            this.histogram.put(aggregation.getName(), aggregation);
            return this;
        }

        public Builder groupByColumns(List<String> columns) {
            this.groupByColumns.addAll(columns);
            return this;
        }

        public Builder measureFunctions(List<String> functions) {
            this.measureFunctions.addAll(functions);
            return this;
        }

        public Builder measureRow(BucketRow row) {
            this.measureResults.add(row);
            return this;
        }

        public Builder columnsOrder(Map<String, Integer> columnsOrder) {
            this.columnsOrder.putAll(columnsOrder);
            return this;
        }

        public NodeResult build() {
            return new NodeResult(this);
        }
    }
}
