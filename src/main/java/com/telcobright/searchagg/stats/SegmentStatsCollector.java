package com.telcobright.searchagg.stats;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Collects per-column statistics from workers that search blocks of one segment in parallel,
 * before the merged map is handed to the query controller.
 */
public class SegmentStatsCollector {

    // Write lock: merging a worker's map; read lock: snapshotting the merged map
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ColumnStats> segmentStats = new LinkedHashMap<>();
    private final int recordCapacity;

    public SegmentStatsCollector() {
        this(Integer.MAX_VALUE);
    }

    public SegmentStatsCollector(int recordCapacity) {
        this.recordCapacity = recordCapacity;
    }

    public void mergeSegmentStats(Map<String, ColumnStats> blockStats) {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, ColumnStats> entry : blockStats.entrySet()) {
                ColumnStats existing = segmentStats.get(entry.getKey());
                if (existing == null) {
                    segmentStats.put(entry.getKey(), entry.getValue().copy());
                } else {
                    existing.mergeAll(entry.getValue(), recordCapacity);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Snapshot of the merged statistics; later merges do not affect the returned map.
     */
    public Map<String, ColumnStats> getSegmentStats() {
        lock.readLock().lock();
        try {
            Map<String, ColumnStats> copy = new LinkedHashMap<>();
            segmentStats.forEach((k, v) -> copy.put(k, v.copy()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }
}
