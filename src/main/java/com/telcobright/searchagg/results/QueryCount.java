package com.telcobright.searchagg.results;

/**
 * Hit count reported to the caller. When the query exited early the true count may be higher.
 */
public class QueryCount {

    public enum Relation {
        EQUALS,
        GREATER_THAN_OR_EQUAL
    }

    private final long totalCount;
    private final boolean earlyExitAllowed;
    private final Relation relation;

    public QueryCount(long totalCount, boolean earlyExitAllowed, Relation relation) {
        this.totalCount = totalCount;
        this.earlyExitAllowed = earlyExitAllowed;
        this.relation = relation;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEarlyExitAllowed() {
        return earlyExitAllowed;
    }

    public Relation getRelation() {
        return relation;
    }

    @Override
    public String toString() {
        return (relation == Relation.EQUALS ? "=" : ">=") + totalCount;
    }
}
