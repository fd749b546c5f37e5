package com.telcobright.searchagg.results;

import java.util.List;

/**
 * Ranks matched records and keeps at most a fixed number of the best ones.
 *
 * Implementations do not need to be thread-safe; the query controller serializes all calls.
 */
public interface BoundedResultMerger {

    /**
     * Offers a record. When the container is full and the record ranks better than the current
     * worst, the worst record is evicted and its id reported in the outcome.
     */
    AddOutcome add(RecordResult record);

    /**
     * Whether a record with this id is currently retained.
     */
    boolean contains(String recordId);

    /**
     * Whether a record with the given sort value would currently be admitted.
     */
    boolean willValueBeAdded(double sortValue);

    /**
     * Retained records, best first. The returned list may be a view of internal state.
     */
    List<RecordResult> getResults();

    /**
     * Retained records, best first, in a list the caller owns.
     */
    List<RecordResult> getResultsCopy();

    int size();

    int capacity();
}
