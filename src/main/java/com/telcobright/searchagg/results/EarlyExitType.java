package com.telcobright.searchagg.results;

/**
 * How much of a candidate segment still has to be searched.
 */
public enum EarlyExitType {
    CONTINUE_SCAN("Continue search"),
    AGGREGATES_ONLY("Match all aggs"),
    SKIP_ENTIRELY("Early exit");

    private final String description;

    EarlyExitType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
