package com.telcobright.searchagg.bucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-oriented bucket output plus the metadata a presentation layer needs to build headers.
 */
public class MaterializedBuckets {

    private final List<BucketRow> rows;
    private final List<String> measureFunctions;
    private final List<String> groupByColumns;
    private final Map<String, Integer> columnsOrder;
    private final int added;

    public MaterializedBuckets(List<BucketRow> rows, List<String> measureFunctions, int added) {
        this(rows, measureFunctions, Collections.emptyList(), Collections.emptyMap(), added);
    }

    public MaterializedBuckets(List<BucketRow> rows, List<String> measureFunctions, List<String> groupByColumns,
                               Map<String, Integer> columnsOrder, int added) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.measureFunctions = Collections.unmodifiableList(new ArrayList<>(measureFunctions));
        this.groupByColumns = groupByColumns == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(groupByColumns));
        this.columnsOrder = columnsOrder == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(columnsOrder));
        this.added = added;
    }

    public static MaterializedBuckets empty() {
        return new MaterializedBuckets(Collections.emptyList(), Collections.emptyList(), 0);
    }

    /**
     * Same rows, annotated with the query's group-by columns and column ordering.
     */
    public MaterializedBuckets withColumns(List<String> groupByColumns, Map<String, Integer> columnsOrder) {
        return new MaterializedBuckets(rows, measureFunctions, groupByColumns, columnsOrder, added);
    }

    public List<BucketRow> getRows() {
        return rows;
    }

    /**
     * Measure names for column headers.
     */
    public List<String> getMeasureFunctions() {
        return measureFunctions;
    }

    public List<String> getGroupByColumns() {
        return groupByColumns;
    }

    public Map<String, Integer> getColumnsOrder() {
        return columnsOrder;
    }

    /**
     * Number of rows emitted, or of measure values for a statistics row.
     */
    public int getAdded() {
        return added;
    }
}
