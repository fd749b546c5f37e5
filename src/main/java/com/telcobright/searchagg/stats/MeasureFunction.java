package com.telcobright.searchagg.stats;

import java.util.Locale;

/**
 * Aggregation functions the running statistics merger knows how to fold across segments.
 */
public enum MeasureFunction {
    MIN("min"),
    MAX("max"),
    SUM("sum"),
    COUNT("count"),
    AVG("avg"),
    RANGE("range"),
    CARDINALITY("cardinality"),
    VALUES("values"),
    LIST("list");

    private final String functionName;

    MeasureFunction(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * True when the function needs numeric min/max/sum statistics from the column.
     */
    public boolean requiresNumericStats() {
        return this == MIN || this == MAX || this == SUM || this == AVG || this == RANGE;
    }

    public static MeasureFunction fromName(String name) {
        if (name == null) {
            throw new UnsupportedAggregationException("Aggregation function name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MeasureFunction function : values()) {
            if (function.functionName.equals(normalized)) {
                return function;
            }
        }
        throw new UnsupportedAggregationException("Unknown aggregation function: " + name);
    }

    @Override
    public String toString() {
        return functionName;
    }
}
