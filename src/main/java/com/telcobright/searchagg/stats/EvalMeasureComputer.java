package com.telcobright.searchagg.stats;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Computes expression ("eval") measures for one segment and folds them into the query's
 * measure results. The expression runs once per record over the segment's per-record column
 * values; cross-segment state that cannot be recovered from the current result lives in
 * {@link EvalAccumulators}.
 */
public class EvalMeasureComputer {

    private final int listCapacity;

    public EvalMeasureComputer(int listCapacity) {
        this.listCapacity = listCapacity;
    }

    public void compute(MeasureAggregator measure, Map<String, ColumnStats> segmentStats,
                        Map<String, MeasureValue> measureResults,
                        EvalAccumulators accumulators) throws MeasureEvaluationException {
        String measureId = measure.toString();
        List<Object> values = evaluate(measure, segmentStats);

        switch (measure.getFunction()) {
            case MIN:
            case MAX: {
                Number extreme = null;
                for (Object value : values) {
                    Number n = requireNumber(measureId, value);
                    if (n == null) continue;
                    extreme = measure.getFunction() == MeasureFunction.MIN
                        ? Numbers.min(extreme, n)
                        : Numbers.max(extreme, n);
                }
                if (extreme == null) {
                    return;
                }
                MeasureValue current = measureResults.get(measureId);
                if (current != null && current.isNumeric()) {
                    extreme = measure.getFunction() == MeasureFunction.MIN
                        ? Numbers.min(current.asNumber(), extreme)
                        : Numbers.max(current.asNumber(), extreme);
                }
                measureResults.put(measureId, MeasureValue.ofNumber(extreme));
                return;
            }
            case RANGE: {
                Number min = null;
                Number max = null;
                for (Object value : values) {
                    Number n = requireNumber(measureId, value);
                    if (n == null) continue;
                    min = Numbers.min(min, n);
                    max = Numbers.max(max, n);
                }
                if (min != null) {
                    accumulators.accumulateRange(measureId, min, max);
                }
                Number range = accumulators.range(measureId);
                if (range != null) {
                    measureResults.put(measureId, MeasureValue.ofNumber(range));
                }
                return;
            }
            case SUM: {
                Number sum = null;
                for (Object value : values) {
                    sum = Numbers.add(sum, requireNumber(measureId, value));
                }
                if (sum == null) {
                    return;
                }
                MeasureValue current = measureResults.get(measureId);
                if (current != null && current.isNumeric()) {
                    sum = Numbers.add(current.asNumber(), sum);
                }
                measureResults.put(measureId, MeasureValue.ofNumber(sum));
                return;
            }
            case AVG: {
                Number sum = null;
                long count = 0;
                for (Object value : values) {
                    Number n = requireNumber(measureId, value);
                    if (n == null) continue;
                    sum = Numbers.add(sum, n);
                    count++;
                }
                if (count > 0) {
                    accumulators.accumulateAvg(measureId, sum, count);
                }
                Double average = accumulators.average(measureId);
                if (average != null) {
                    measureResults.put(measureId, MeasureValue.ofDouble(average));
                }
                return;
            }
            case COUNT: {
                // Boolean expressions count matching records; any other non-null value counts once.
                long count = 0;
                for (Object value : values) {
                    if (value == null || Boolean.FALSE.equals(value)) continue;
                    count++;
                }
                MeasureValue current = measureResults.get(measureId);
                long total = current != null && current.isNumeric() ? current.asNumber().longValue() : 0;
                measureResults.put(measureId, MeasureValue.ofLong(total + count));
                return;
            }
            case CARDINALITY: {
                int size = accumulators.addUniqueValues(measureId, render(values)).size();
                measureResults.put(measureId, MeasureValue.ofLong(size));
                return;
            }
            case VALUES: {
                TreeSet<String> sorted = new TreeSet<>(accumulators.addUniqueValues(measureId, render(values)));
                measureResults.put(measureId, MeasureValue.ofStrings(new ArrayList<>(sorted)));
                return;
            }
            case LIST: {
                List<String> list = accumulators.appendToList(measureId, render(values), listCapacity);
                measureResults.put(measureId, MeasureValue.ofStrings(list));
                return;
            }
            default:
                throw new UnsupportedAggregationException("Unsupported aggregation function: " + measure.getFunction());
        }
    }

    private List<Object> evaluate(MeasureAggregator measure, Map<String, ColumnStats> segmentStats)
            throws MeasureEvaluationException {
        String measureId = measure.toString();
        ValueExpression expression = measure.getExpression();

        int recordCount = -1;
        Map<String, List<Object>> columns = new HashMap<>();
        for (String column : expression.getRequiredColumns()) {
            ColumnStats stats = segmentStats.get(column);
            if (stats == null) {
                throw new MeasureEvaluationException(measureId,
                    "Column " + column + " required by " + measureId + " is missing from segment statistics");
            }
            List<Object> records = stats.getRecords();
            if (recordCount >= 0 && records.size() != recordCount) {
                throw new MeasureEvaluationException(measureId, String.format(
                    "Column %s has %d record values but other columns of %s have %d",
                    column, records.size(), measureId, recordCount));
            }
            recordCount = records.size();
            columns.put(column, records);
        }
        if (recordCount < 0) {
            recordCount = 0;
        }

        List<Object> results = new ArrayList<>(recordCount);
        Map<String, Object> fieldValues = new HashMap<>();
        for (int i = 0; i < recordCount; i++) {
            fieldValues.clear();
            for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
                fieldValues.put(entry.getKey(), entry.getValue().get(i));
            }
            results.add(expression.evaluate(fieldValues));
        }
        return results;
    }

    private static Number requireNumber(String measureId, Object value) throws MeasureEvaluationException {
        if (value == null) {
            return null;
        }
        Number n = Numbers.normalize(value);
        if (n == null) {
            throw new MeasureEvaluationException(measureId,
                "Expression of " + measureId + " produced non-numeric value: " + value);
        }
        return n;
    }

    private static List<String> render(List<Object> values) {
        List<String> rendered = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null) {
                rendered.add(Numbers.toCanonicalString(value));
            }
        }
        return rendered;
    }
}
