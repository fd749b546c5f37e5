package com.telcobright.searchagg.stats;

import java.util.Objects;

/**
 * One requested measure: a function applied either to a column or to an expression.
 * The string form ({@code func(column)} or {@code func(eval(expr))}) identifies the measure
 * in results and in the eval accumulators.
 */
public class MeasureAggregator {

    public static final String WILDCARD_COLUMN = "*";

    private final MeasureFunction function;
    private final String column;
    private final ValueExpression expression;

    private MeasureAggregator(MeasureFunction function, String column, ValueExpression expression) {
        this.function = Objects.requireNonNull(function, "function");
        this.column = column;
        this.expression = expression;
    }

    public static MeasureAggregator of(MeasureFunction function, String column) {
        if (column == null || column.trim().isEmpty()) {
            throw new IllegalArgumentException("Measure column cannot be null or empty");
        }
        return new MeasureAggregator(function, column, null);
    }

    public static MeasureAggregator of(String functionName, String column) {
        return of(MeasureFunction.fromName(functionName), column);
    }

    public static MeasureAggregator eval(MeasureFunction function, ValueExpression expression) {
        Objects.requireNonNull(expression, "expression");
        return new MeasureAggregator(function, null, expression);
    }

    public MeasureFunction getFunction() {
        return function;
    }

    public String getColumn() {
        return column;
    }

    public ValueExpression getExpression() {
        return expression;
    }

    public boolean isExpression() {
        return expression != null;
    }

    public boolean isWildcardCount() {
        return function == MeasureFunction.COUNT && WILDCARD_COLUMN.equals(column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        if (expression != null) {
            return function.getFunctionName() + "(eval(" + expression.describe() + "))";
        }
        return function.getFunctionName() + "(" + column + ")";
    }
}
