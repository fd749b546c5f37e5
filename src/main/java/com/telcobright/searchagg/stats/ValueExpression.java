package com.telcobright.searchagg.stats;

import java.util.Map;
import java.util.Set;

/**
 * An expression evaluated once per record to produce the input of an eval-style measure,
 * e.g. {@code avg(eval(latency * 1000))}. Implementations come from the query language layer.
 */
public interface ValueExpression {

    /**
     * Columns whose per-record values must be present in the segment statistics.
     */
    Set<String> getRequiredColumns();

    /**
     * Evaluate against one record.
     *
     * @param fieldValues value of every required column for this record; values may be null
     * @return the computed value, or null when the record contributes nothing
     */
    Object evaluate(Map<String, Object> fieldValues) throws MeasureEvaluationException;

    /**
     * Stable text form, used to build the measure identifier.
     */
    String describe();
}
