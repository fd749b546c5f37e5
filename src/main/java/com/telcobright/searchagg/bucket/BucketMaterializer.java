package com.telcobright.searchagg.bucket;

import com.telcobright.searchagg.stats.MeasureValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Flattens aggregation results into rows. Rows follow aggregation order, then bucket order;
 * no sorting is applied.
 */
public final class BucketMaterializer {

    private BucketMaterializer() {
    }

    /**
     * @param limit maximum number of rows across all aggregations
     */
    public static MaterializedBuckets materialize(int limit, Map<String, AggregationResult> aggregations) {
        if (aggregations == null || aggregations.isEmpty() || limit <= 0) {
            return MaterializedBuckets.empty();
        }

        List<BucketRow> rows = new ArrayList<>();
        TreeSet<String> measureNames = new TreeSet<>();
        int added = 0;

        outer:
        for (AggregationResult aggregation : aggregations.values()) {
            for (BucketResult bucket : aggregation.getResults()) {
                if (added >= limit) {
                    break outer;
                }
                Map<String, Object> measureValues = new LinkedHashMap<>();
                for (Map.Entry<String, MeasureValue> entry : bucket.getStatRes().entrySet()) {
                    measureNames.add(entry.getKey());
                    measureValues.put(entry.getKey(), entry.getValue().getValue());
                }
                rows.add(new BucketRow(bucket.getKey().render(), measureValues));
                added++;
            }
        }

        return new MaterializedBuckets(rows, new ArrayList<>(measureNames), added);
    }
}
