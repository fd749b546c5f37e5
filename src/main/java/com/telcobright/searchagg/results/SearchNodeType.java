package com.telcobright.searchagg.results;

/**
 * Shape of the search node evaluated against a segment.
 */
public enum SearchNodeType {
    /** Unfiltered query; every record in range matches. */
    MATCH_ALL,
    /** Any query with a filter. */
    FILTERED
}
