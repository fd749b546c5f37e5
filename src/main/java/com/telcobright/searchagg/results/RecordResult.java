package com.telcobright.searchagg.results;

import java.util.Objects;

/**
 * Reference to one matched record: enough to rank it and to look up its raw payload later.
 * Immutable.
 */
public class RecordResult {

    private final String recordId;
    private final String segmentKey;
    private final double sortValue;
    private final long timestamp;
    private final boolean remote;

    public RecordResult(String recordId, String segmentKey, double sortValue, long timestamp, boolean remote) {
        if (recordId == null || recordId.isEmpty()) {
            throw new IllegalArgumentException("Record id cannot be null or empty");
        }
        this.recordId = recordId;
        this.segmentKey = segmentKey;
        this.sortValue = sortValue;
        this.timestamp = timestamp;
        this.remote = remote;
    }

    /**
     * A record matched by a local segment search.
     */
    public static RecordResult local(String recordId, String segmentKey, double sortValue, long timestamp) {
        return new RecordResult(recordId, segmentKey, sortValue, timestamp, false);
    }

    /**
     * A record contributed by a peer node. Remote record ids start with the peer's id.
     */
    public static RecordResult remote(String recordId, double sortValue, long timestamp) {
        return new RecordResult(recordId, null, sortValue, timestamp, true);
    }

    public String getRecordId() {
        return recordId;
    }

    public String getSegmentKey() {
        return segmentKey;
    }

    public double getSortValue() {
        return sortValue;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isRemote() {
        return remote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordResult that = (RecordResult) o;
        return Double.compare(that.sortValue, sortValue) == 0
            && timestamp == that.timestamp
            && remote == that.remote
            && recordId.equals(that.recordId)
            && Objects.equals(segmentKey, that.segmentKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, segmentKey, sortValue, timestamp, remote);
    }

    @Override
    public String toString() {
        return "RecordResult{id=" + recordId + ", sortValue=" + sortValue + (remote ? ", remote" : "") + '}';
    }
}
