package com.telcobright.searchagg.stats;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Per-function merge rules shared by the query-level statistics merger and by bucket merging.
 *
 * {@link #fold} only touches the parts of the running statistics the function reads, so a
 * Min slot never accumulates per-record values and a List slot never tracks a sum.
 */
public final class StatisticsFolding {

    private StatisticsFolding() {
    }

    public static void fold(MeasureAggregator measure, ColumnStats running, ColumnStats incoming,
                            int listCapacity) throws MeasureEvaluationException {
        validate(measure, incoming);

        MeasureFunction function = measure.getFunction();
        switch (function) {
            case MIN:
                if (incoming.hasNumericStats()) {
                    running.mergeMin(incoming.getMin());
                    running.markNumeric();
                }
                break;
            case MAX:
                if (incoming.hasNumericStats()) {
                    running.mergeMax(incoming.getMax());
                    running.markNumeric();
                }
                break;
            case RANGE:
                if (incoming.hasNumericStats()) {
                    running.mergeMin(incoming.getMin());
                    running.mergeMax(incoming.getMax());
                    running.markNumeric();
                }
                break;
            case SUM:
            case AVG:
                if (incoming.hasNumericStats()) {
                    running.mergeSum(incoming.getSum());
                    running.addCount(incoming.getCount());
                    running.markNumeric();
                }
                break;
            case COUNT:
                running.addCount(incoming.getCount());
                break;
            case CARDINALITY:
            case VALUES:
                running.addStringValues(incoming.getStringValues());
                break;
            case LIST:
                running.appendRecords(incoming.getRecords(), listCapacity);
                break;
            default:
                throw new UnsupportedAggregationException("Unsupported aggregation function: " + function);
        }
    }

    /**
     * Checks that {@code incoming} can be folded for {@code measure}; {@link #fold} never fails
     * once this has passed.
     */
    public static void validate(MeasureAggregator measure, ColumnStats incoming) throws MeasureEvaluationException {
        if (measure.getFunction().requiresNumericStats() && incoming.getCount() > 0 && !incoming.hasNumericStats()) {
            throw new MeasureEvaluationException(measure.toString(),
                "Column statistics for " + measure + " are not numeric");
        }
    }

    /**
     * Final value of a measure from its running statistics; null when nothing has contributed yet.
     */
    public static MeasureValue result(MeasureFunction function, ColumnStats running) {
        switch (function) {
            case MIN:
                return running.getMin() != null ? MeasureValue.ofNumber(running.getMin()) : null;
            case MAX:
                return running.getMax() != null ? MeasureValue.ofNumber(running.getMax()) : null;
            case RANGE:
                if (running.getMin() == null || running.getMax() == null) {
                    return null;
                }
                return MeasureValue.ofNumber(Numbers.subtract(running.getMax(), running.getMin()));
            case SUM:
                return running.getSum() != null ? MeasureValue.ofNumber(running.getSum()) : null;
            case AVG:
                if (running.getSum() == null || running.getCount() == 0) {
                    return null;
                }
                return MeasureValue.ofDouble(running.getSum().doubleValue() / running.getCount());
            case COUNT:
                return MeasureValue.ofLong(running.getCount());
            case CARDINALITY:
                return MeasureValue.ofLong(running.getStringValues().size());
            case VALUES:
                return MeasureValue.ofStrings(new ArrayList<>(new TreeSet<>(running.getStringValues())));
            case LIST:
                List<String> rendered = new ArrayList<>(running.getRecords().size());
                for (Object record : running.getRecords()) {
                    if (record != null) {
                        rendered.add(Numbers.toCanonicalString(record));
                    }
                }
                return MeasureValue.ofStrings(rendered);
            default:
                throw new UnsupportedAggregationException("Unsupported aggregation function: " + function);
        }
    }
}
