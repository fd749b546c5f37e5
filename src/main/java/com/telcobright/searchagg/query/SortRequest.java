package com.telcobright.searchagg.query;

import java.util.Objects;

/**
 * Sort applied to raw records.
 */
public class SortRequest {

    public enum SortOrder {
        ASC,
        DESC
    }

    private final String column;
    private final SortOrder order;

    public SortRequest(String column, SortOrder order) {
        if (column == null || column.trim().isEmpty()) {
            throw new IllegalArgumentException("Sort column cannot be null or empty");
        }
        this.column = column;
        this.order = Objects.requireNonNull(order, "order");
    }

    public static SortRequest ascending(String column) {
        return new SortRequest(column, SortOrder.ASC);
    }

    public static SortRequest descending(String column) {
        return new SortRequest(column, SortOrder.DESC);
    }

    public String getColumn() {
        return column;
    }

    public SortOrder getOrder() {
        return order;
    }

    public boolean isAscending() {
        return order == SortOrder.ASC;
    }

    @Override
    public String toString() {
        return column + " " + order;
    }
}
