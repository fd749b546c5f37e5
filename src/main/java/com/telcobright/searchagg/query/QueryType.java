package com.telcobright.searchagg.query;

/**
 * Shape of a query; decides which merge paths and early-exit rules apply.
 */
public enum QueryType {
    /** Returns raw matched records, optionally with histograms. */
    RAW_RECORD,
    /** Returns group-by buckets. */
    GROUP_BY,
    /** Returns whole-query statistics computed from segment statistics. */
    SEGMENT_STATISTICS
}
