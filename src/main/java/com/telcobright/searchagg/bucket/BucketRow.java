package com.telcobright.searchagg.bucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One output row: the bucket's group-by values (in group-by column order) and the value of
 * every measure computed for it.
 */
public class BucketRow {
    private final List<String> groupByValues;
    private final Map<String, Object> measureValues;

    public BucketRow(List<String> groupByValues, Map<String, Object> measureValues) {
        this.groupByValues = Collections.unmodifiableList(new ArrayList<>(groupByValues));
        this.measureValues = Collections.unmodifiableMap(new LinkedHashMap<>(measureValues));
    }

    public List<String> getGroupByValues() {
        return groupByValues;
    }

    public Map<String, Object> getMeasureValues() {
        return measureValues;
    }

    public Object getMeasureValue(String name) {
        return measureValues.get(name);
    }

    public String getString(String name) {
        Object value = measureValues.get(name);
        return value != null ? value.toString() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BucketRow that = (BucketRow) o;
        return groupByValues.equals(that.groupByValues) && measureValues.equals(that.measureValues);
    }

    @Override
    public int hashCode() {
        return 31 * groupByValues.hashCode() + measureValues.hashCode();
    }

    @Override
    public String toString() {
        return "BucketRow{groupBy=" + groupByValues + ", measures=" + measureValues + '}';
    }
}
