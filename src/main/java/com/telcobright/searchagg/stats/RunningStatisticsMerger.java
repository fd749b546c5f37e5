package com.telcobright.searchagg.stats;

import com.telcobright.searchagg.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds one segment's column statistics at a time into the running measure results of a query.
 *
 * Not thread-safe; the owning controller calls it under its lock.
 */
public class RunningStatisticsMerger {

    private final Logger logger;
    private final long queryId;
    private final int listCapacity;
    private final EvalMeasureComputer evalComputer;

    // one running slot per plain measure, keyed by measure id; absent until the first contribution
    private final Map<String, ColumnStats> runningStats = new HashMap<>();
    private final EvalAccumulators evalAccumulators = new EvalAccumulators();
    private final Map<String, MeasureValue> measureResults = new LinkedHashMap<>();

    public RunningStatisticsMerger(long queryId, int listCapacity, Logger logger) {
        this.queryId = queryId;
        this.listCapacity = listCapacity;
        this.logger = logger;
        this.evalComputer = new EvalMeasureComputer(listCapacity);
    }

    /**
     * Merge one segment's statistics for every given measure.
     *
     * @return per-measure failures for this segment; empty when every measure merged or was skipped
     * @throws UnsupportedAggregationException if a measure uses a function this merger cannot fold
     */
    public List<MeasureEvaluationException> merge(Map<String, ColumnStats> segmentStats,
                                                  List<MeasureAggregator> measures) {
        if (segmentStats == null || segmentStats.isEmpty()) {
            return Collections.emptyList();
        }

        List<MeasureEvaluationException> failures = new ArrayList<>();
        for (MeasureAggregator measure : measures) {
            try {
                if (measure.isExpression()) {
                    evalComputer.compute(measure, segmentStats, measureResults, evalAccumulators);
                } else {
                    mergePlain(measure, segmentStats);
                }
            } catch (MeasureEvaluationException e) {
                failures.add(e);
            }
        }
        return failures;
    }

    private void mergePlain(MeasureAggregator measure, Map<String, ColumnStats> segmentStats)
            throws MeasureEvaluationException {
        String column = measure.getColumn();
        if (measure.isWildcardCount()) {
            // any column carries the segment's record count; take the first one
            column = segmentStats.keySet().iterator().next();
        }

        ColumnStats incoming = segmentStats.get(column);
        if (incoming == null) {
            logger.debug(String.format("Column %s absent from segment statistics, skipping %s, qid=%d",
                column, measure, queryId));
            return;
        }

        String measureId = measure.toString();
        ColumnStats running = runningStats.get(measureId);
        if (running == null) {
            running = ColumnStats.empty();
        }
        // fold validates before it mutates, so a failure leaves the slot untouched
        StatisticsFolding.fold(measure, running, incoming, listCapacity);
        runningStats.put(measureId, running);

        MeasureValue value = StatisticsFolding.result(measure.getFunction(), running);
        if (value != null) {
            measureResults.put(measureId, value);
        }
    }

    /**
     * Current value of every measure that has received at least one contribution.
     */
    public Map<String, MeasureValue> getMeasureResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(measureResults));
    }

    /**
     * Running statistics of plain measures, keyed by measure id.
     */
    public Map<String, ColumnStats> getRunningStats() {
        Map<String, ColumnStats> copy = new LinkedHashMap<>();
        runningStats.forEach((k, v) -> copy.put(k, v.copy()));
        return copy;
    }

    /**
     * Replaces every measure result with externally computed final values.
     */
    public void replaceResults(Map<String, MeasureValue> finalResults) {
        measureResults.clear();
        measureResults.putAll(finalResults);
    }
}
