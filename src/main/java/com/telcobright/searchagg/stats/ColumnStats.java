package com.telcobright.searchagg.stats;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mergeable statistics for one column of one segment (or of many segments once merged).
 *
 * Carries everything any measure function needs to resume merging: the value count,
 * numeric min/max/sum when the column is numeric, the set of distinct string renderings,
 * and the per-record values that expression measures and List evaluate against.
 * Record values are positional: index i of every column in one segment belongs to the same record.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
public class ColumnStats {

    private boolean numeric;
    private long count;
    private Number min;
    private Number max;
    private Number sum;
    private final Set<String> stringValues;
    private final List<Object> records;

    @JsonCreator
    public ColumnStats(
        @JsonProperty("numeric") boolean numeric,
        @JsonProperty("count") long count,
        @JsonProperty("min") Number min,
        @JsonProperty("max") Number max,
        @JsonProperty("sum") Number sum,
        @JsonProperty("stringValues") Set<String> stringValues,
        @JsonProperty("records") List<Object> records
    ) {
        this.numeric = numeric;
        this.count = count;
        this.min = Numbers.normalize(min);
        this.max = Numbers.normalize(max);
        this.sum = Numbers.normalize(sum);
        this.stringValues = stringValues != null ? new LinkedHashSet<>(stringValues) : new LinkedHashSet<>();
        this.records = new ArrayList<>();
        if (records != null) {
            for (Object record : records) {
                Number n = Numbers.normalize(record);
                this.records.add(n != null ? n : record);
            }
        }
    }

    /**
     * Empty running statistics, used as the starting point of a merge.
     */
    public static ColumnStats empty() {
        return new ColumnStats(false, 0, null, null, null, null, null);
    }

    /**
     * Summary-only statistics without per-record values.
     */
    public static ColumnStats ofSummary(long count, Number min, Number max, Number sum) {
        return new ColumnStats(true, count, min, max, sum, null, null);
    }

    /**
     * Builds statistics from the raw values of a column, in record order. Null values keep
     * their record position but are not counted.
     */
    public static ColumnStats fromValues(List<?> values) {
        ColumnStats stats = empty();
        boolean allNumeric = true;
        for (Object value : values) {
            stats.records.add(Numbers.normalize(value) != null ? Numbers.normalize(value) : value);
            if (value == null) {
                continue;
            }
            stats.count++;
            stats.stringValues.add(Numbers.toCanonicalString(value));
            Number n = Numbers.normalize(value);
            if (n == null) {
                allNumeric = false;
                continue;
            }
            stats.min = Numbers.min(stats.min, n);
            stats.max = Numbers.max(stats.max, n);
            stats.sum = Numbers.add(stats.sum, n);
        }
        stats.numeric = allNumeric && stats.count > 0;
        if (!stats.numeric) {
            stats.min = null;
            stats.max = null;
            stats.sum = null;
        }
        return stats;
    }

    public static ColumnStats fromValues(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return fromValues(list);
    }

    public boolean isNumeric() {
        return numeric;
    }

    public long getCount() {
        return count;
    }

    public Number getMin() {
        return min;
    }

    public Number getMax() {
        return max;
    }

    public Number getSum() {
        return sum;
    }

    public Set<String> getStringValues() {
        return Collections.unmodifiableSet(stringValues);
    }

    public List<Object> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public boolean hasNumericStats() {
        return numeric && min != null && max != null && sum != null;
    }

    /**
     * Merges every field of {@code other} into this instance.
     *
     * @param recordCapacity upper bound on retained per-record values
     */
    public void mergeAll(ColumnStats other, int recordCapacity) {
        if (other == null) {
            return;
        }
        boolean contributes = other.count > 0 || other.hasNumericStats();
        boolean wasEmpty = count == 0 && min == null;
        addCount(other.count);
        if (other.hasNumericStats()) {
            mergeNumeric(other);
        }
        if (contributes) {
            numeric = wasEmpty ? other.numeric : numeric && other.numeric;
        }
        addStringValues(other.stringValues);
        appendRecords(other.records, recordCapacity);
    }

    void addCount(long delta) {
        count += delta;
    }

    void mergeMin(Number value) {
        min = Numbers.min(min, value);
    }

    void mergeMax(Number value) {
        max = Numbers.max(max, value);
    }

    void mergeSum(Number value) {
        sum = Numbers.add(sum, value);
    }

    void mergeNumeric(ColumnStats other) {
        mergeMin(other.min);
        mergeMax(other.max);
        mergeSum(other.sum);
    }

    void markNumeric() {
        numeric = true;
    }

    void addStringValues(Set<String> values) {
        stringValues.addAll(values);
    }

    void appendRecords(List<Object> values, int capacity) {
        for (Object value : values) {
            if (records.size() >= capacity) {
                return;
            }
            records.add(value);
        }
    }

    /**
     * Deep copy; the running statistics of a query never alias a segment's statistics.
     */
    public ColumnStats copy() {
        return new ColumnStats(numeric, count, min, max, sum, stringValues, records);
    }

    @Override
    public String toString() {
        return String.format("ColumnStats{numeric=%s, count=%d, min=%s, max=%s, sum=%s, distinct=%d, records=%d}",
            numeric, count, min, max, sum, stringValues.size(), records.size());
    }
}
