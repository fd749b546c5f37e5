package com.telcobright.searchagg.results;

/**
 * Result of offering one record to a {@link BoundedResultMerger}.
 */
public final class AddOutcome {

    private static final AddOutcome REJECTED = new AddOutcome(false, null);
    private static final AddOutcome ADDED = new AddOutcome(true, null);

    private final boolean added;
    private final String evictedId;

    private AddOutcome(boolean added, String evictedId) {
        this.added = added;
        this.evictedId = evictedId;
    }

    public static AddOutcome rejected() {
        return REJECTED;
    }

    public static AddOutcome added() {
        return ADDED;
    }

    public static AddOutcome addedEvicting(String evictedId) {
        return evictedId == null || evictedId.isEmpty() ? ADDED : new AddOutcome(true, evictedId);
    }

    public boolean isAdded() {
        return added;
    }

    /**
     * Id of the record displaced by this insertion, or null when nothing was evicted.
     */
    public String getEvictedId() {
        return evictedId;
    }

    public boolean hasEviction() {
        return evictedId != null;
    }

    @Override
    public String toString() {
        return "AddOutcome{added=" + added + ", evicted=" + evictedId + '}';
    }
}
