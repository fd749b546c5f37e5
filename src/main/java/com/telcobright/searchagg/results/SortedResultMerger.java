package com.telcobright.searchagg.results;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Heap-backed {@link BoundedResultMerger}. The heap head is the worst retained record, so an
 * insertion into a full container is one comparison plus at most one poll/offer.
 *
 * Records rank by sort value (ascending or descending), ties by record id. A record whose id is
 * already retained is rejected.
 */
public class SortedResultMerger implements BoundedResultMerger {

    private final int sizeLimit;
    private final boolean ascending;
    private final Comparator<RecordResult> bestFirst;
    private final PriorityQueue<RecordResult> heap;
    private final Set<String> retainedIds = new HashSet<>();

    public SortedResultMerger(int sizeLimit, boolean ascending) {
        if (sizeLimit < 0) {
            throw new IllegalArgumentException("sizeLimit cannot be negative");
        }
        this.sizeLimit = sizeLimit;
        this.ascending = ascending;
        Comparator<RecordResult> byValue = Comparator.comparingDouble(RecordResult::getSortValue);
        if (!ascending) {
            byValue = byValue.reversed();
        }
        this.bestFirst = byValue.thenComparing(RecordResult::getRecordId);
        this.heap = new PriorityQueue<>(Math.max(1, sizeLimit), bestFirst.reversed());
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public AddOutcome add(RecordResult record) {
        if (sizeLimit == 0 || retainedIds.contains(record.getRecordId())) {
            return AddOutcome.rejected();
        }
        if (heap.size() < sizeLimit) {
            heap.offer(record);
            retainedIds.add(record.getRecordId());
            return AddOutcome.added();
        }
        RecordResult worst = heap.peek();
        if (bestFirst.compare(record, worst) >= 0) {
            return AddOutcome.rejected();
        }
        heap.poll();
        retainedIds.remove(worst.getRecordId());
        heap.offer(record);
        retainedIds.add(record.getRecordId());
        return AddOutcome.addedEvicting(worst.getRecordId());
    }

    @Override
    public boolean contains(String recordId) {
        return retainedIds.contains(recordId);
    }

    @Override
    public boolean willValueBeAdded(double sortValue) {
        if (sizeLimit == 0) {
            return false;
        }
        if (heap.size() < sizeLimit) {
            return true;
        }
        double worst = heap.peek().getSortValue();
        return ascending ? sortValue < worst : sortValue > worst;
    }

    @Override
    public List<RecordResult> getResults() {
        return Collections.unmodifiableList(sorted());
    }

    @Override
    public List<RecordResult> getResultsCopy() {
        return sorted();
    }

    private List<RecordResult> sorted() {
        List<RecordResult> results = new ArrayList<>(heap);
        results.sort(bestFirst);
        return results;
    }

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public int capacity() {
        return sizeLimit;
    }
}
