package com.telcobright.searchagg.query;

import com.telcobright.searchagg.stats.MeasureAggregator;
import com.telcobright.searchagg.stats.MeasureFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable description of everything a query aggregates: sort, time histogram,
 * group-by and whole-query measures.
 */
public class QueryAggregators {
    private final SortRequest sort;
    private final TimeHistogramRequest timeHistogram;
    private final GroupByRequest groupByRequest;
    private final List<MeasureAggregator> measureOperations;
    private final boolean earlyExit;

    private QueryAggregators(Builder builder) {
        this.sort = builder.sort;
        this.timeHistogram = builder.timeHistogram;
        this.groupByRequest = builder.groupByRequest;
        this.measureOperations = Collections.unmodifiableList(new ArrayList<>(builder.measureOperations));
        this.earlyExit = builder.earlyExit;
    }

    public SortRequest getSort() {
        return sort;
    }

    public TimeHistogramRequest getTimeHistogram() {
        return timeHistogram;
    }

    public GroupByRequest getGroupByRequest() {
        return groupByRequest;
    }

    public List<MeasureAggregator> getMeasureOperations() {
        return measureOperations;
    }

    /**
     * Whether the query may stop scanning once its answer is complete.
     */
    public boolean isEarlyExit() {
        return earlyExit;
    }

    public boolean hasMeasureOperations() {
        return !measureOperations.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SortRequest sort;
        private TimeHistogramRequest timeHistogram;
        private GroupByRequest groupByRequest;
        private final List<MeasureAggregator> measureOperations = new ArrayList<>();
        private boolean earlyExit = true;

        public Builder sort(SortRequest sort) {
            this.sort = sort;
            return this;
        }

        public Builder sortAscending(String column) {
            return sort(SortRequest.ascending(column));
        }

        public Builder sortDescending(String column) {
            return sort(SortRequest.descending(column));
        }

        public Builder timeHistogram(String aggName, long intervalMs) {
            this.timeHistogram = new TimeHistogramRequest(aggName, intervalMs);
            return this;
        }

        public Builder groupBy(GroupByRequest groupByRequest) {
            this.groupByRequest = groupByRequest;
            return this;
        }

        public Builder measure(MeasureAggregator measure) {
            this.measureOperations.add(measure);
            return this;
        }

        public Builder measures(MeasureAggregator... measures) {
            this.measureOperations.addAll(Arrays.asList(measures));
            return this;
        }

        public Builder measure(MeasureFunction function, String column) {
            return measure(MeasureAggregator.of(function, column));
        }

        public Builder earlyExit(boolean earlyExit) {
            this.earlyExit = earlyExit;
            return this;
        }

        public QueryAggregators build() {
            Set<String> seen = new HashSet<>();
            for (MeasureAggregator measure : measureOperations) {
                if (!seen.add(measure.toString())) {
                    throw new IllegalArgumentException("Duplicate measure operation: " + measure);
                }
            }
            return new QueryAggregators(this);
        }
    }
}
