package com.telcobright.searchagg.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-segment running state for expression measures, keyed by the measure identifier.
 */
public class EvalAccumulators {

    // For AVG calculation
    private final Map<String, Number> avgSums = new HashMap<>();
    private final Map<String, Long> avgCounts = new HashMap<>();

    // For RANGE calculation
    private final Map<String, Number> rangeMins = new HashMap<>();
    private final Map<String, Number> rangeMaxs = new HashMap<>();

    // For CARDINALITY and VALUES
    private final Map<String, Set<String>> uniqueValues = new HashMap<>();

    // For LIST
    private final Map<String, List<String>> lists = new HashMap<>();

    public void accumulateAvg(String measureId, Number sum, long count) {
        avgSums.merge(measureId, Numbers.normalize(sum), Numbers::add);
        avgCounts.merge(measureId, count, Long::sum);
    }

    /**
     * Running average, or null if no value has been accumulated.
     */
    public Double average(String measureId) {
        Long count = avgCounts.get(measureId);
        if (count == null || count == 0) {
            return null;
        }
        return avgSums.get(measureId).doubleValue() / count;
    }

    public void accumulateRange(String measureId, Number min, Number max) {
        rangeMins.merge(measureId, Numbers.normalize(min), Numbers::min);
        rangeMaxs.merge(measureId, Numbers.normalize(max), Numbers::max);
    }

    public Number range(String measureId) {
        Number min = rangeMins.get(measureId);
        Number max = rangeMaxs.get(measureId);
        if (min == null || max == null) {
            return null;
        }
        return Numbers.subtract(max, min);
    }

    public Set<String> addUniqueValues(String measureId, Collection<String> values) {
        Set<String> set = uniqueValues.computeIfAbsent(measureId, k -> new LinkedHashSet<>());
        set.addAll(values);
        return set;
    }

    public List<String> appendToList(String measureId, Collection<String> values, int capacity) {
        List<String> list = lists.computeIfAbsent(measureId, k -> new ArrayList<>());
        for (String value : values) {
            if (list.size() >= capacity) {
                break;
            }
            list.add(value);
        }
        return list;
    }
}
