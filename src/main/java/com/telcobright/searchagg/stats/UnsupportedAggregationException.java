package com.telcobright.searchagg.stats;

/**
 * Thrown when a query asks for an aggregation function the core cannot merge.
 * This is a query setup error and should be rejected before any segment is searched.
 */
public class UnsupportedAggregationException extends IllegalArgumentException {

    public UnsupportedAggregationException(String message) {
        super(message);
    }
}
