package com.telcobright.searchagg.bucket;

import com.telcobright.searchagg.stats.ColumnStats;
import com.telcobright.searchagg.stats.MeasureAggregator;
import com.telcobright.searchagg.stats.MeasureEvaluationException;
import com.telcobright.searchagg.stats.MeasureValue;
import com.telcobright.searchagg.stats.StatisticsFolding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running buckets of one aggregation, merged additively from segment and peer contributions.
 * Buckets keep first-seen order. Not thread-safe; owned by the query controller.
 */
public class RunningBuckets {

    private final String aggName;
    private final boolean dateHistogram;
    private final Map<String, MeasureAggregator> measures = new LinkedHashMap<>();
    private final int listCapacity;
    private final Map<BucketKey, RunningBucket> buckets = new LinkedHashMap<>();

    public RunningBuckets(String aggName, boolean dateHistogram, List<MeasureAggregator> measures, int listCapacity) {
        this.aggName = aggName;
        this.dateHistogram = dateHistogram;
        this.listCapacity = listCapacity;
        for (MeasureAggregator measure : measures) {
            this.measures.put(measure.toString(), measure);
        }
    }

    public String getAggName() {
        return aggName;
    }

    public boolean isDateHistogram() {
        return dateHistogram;
    }

    public int size() {
        return buckets.size();
    }

    /**
     * Merges contributions one bucket at a time. Each bucket is validated before it is touched,
     * so a failing contribution leaves that bucket unchanged; buckets merged before it stay merged.
     */
    public void merge(Collection<BucketContribution> contributions) throws BucketMergeException {
        for (BucketContribution contribution : contributions) {
            merge(contribution);
        }
    }

    public void merge(BucketContribution contribution) throws BucketMergeException {
        for (Map.Entry<String, ColumnStats> entry : contribution.getMeasureStats().entrySet()) {
            MeasureAggregator measure = measures.get(entry.getKey());
            if (measure == null) {
                throw new BucketMergeException(String.format(
                    "Aggregation %s has no measure %s (bucket %s)", aggName, entry.getKey(), contribution.getKey()));
            }
            try {
                StatisticsFolding.validate(measure, entry.getValue());
            } catch (MeasureEvaluationException e) {
                throw new BucketMergeException(String.format(
                    "Cannot merge bucket %s of %s: %s", contribution.getKey(), aggName, e.getMessage()), e);
            }
        }

        RunningBucket bucket = buckets.computeIfAbsent(contribution.getKey(), k -> new RunningBucket());
        bucket.docCount += contribution.getDocCount();
        for (Map.Entry<String, ColumnStats> entry : contribution.getMeasureStats().entrySet()) {
            MeasureAggregator measure = measures.get(entry.getKey());
            ColumnStats running = bucket.measureStats.computeIfAbsent(entry.getKey(), k -> ColumnStats.empty());
            try {
                StatisticsFolding.fold(measure, running, entry.getValue(), listCapacity);
            } catch (MeasureEvaluationException e) {
                // validated above
                throw new IllegalStateException("Bucket fold failed after validation", e);
            }
        }
    }

    /**
     * Current buckets with final measure values.
     */
    public AggregationResult toAggregationResult() {
        List<BucketResult> results = new ArrayList<>(buckets.size());
        for (Map.Entry<BucketKey, RunningBucket> entry : buckets.entrySet()) {
            Map<String, MeasureValue> statRes = new LinkedHashMap<>();
            for (Map.Entry<String, ColumnStats> measureEntry : entry.getValue().measureStats.entrySet()) {
                MeasureAggregator measure = measures.get(measureEntry.getKey());
                MeasureValue value = StatisticsFolding.result(measure.getFunction(), measureEntry.getValue());
                if (value != null) {
                    statRes.put(measureEntry.getKey(), value);
                }
            }
            results.add(new BucketResult(entry.getKey(), entry.getValue().docCount, statRes));
        }
        return new AggregationResult(aggName, dateHistogram, results);
    }

    private static final class RunningBucket {
        private long docCount;
        private final Map<String, ColumnStats> measureStats = new LinkedHashMap<>();
    }
}
