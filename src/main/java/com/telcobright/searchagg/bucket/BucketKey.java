package com.telcobright.searchagg.bucket;

import com.telcobright.searchagg.stats.Numbers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identity of one bucket. A key is a single scalar (time bucket start, single-column group-by),
 * a sequence of strings, or a sequence of mixed scalars; each kind renders to an ordered list
 * of strings for output rows.
 */
public final class BucketKey {

    public enum Kind {
        SCALAR,
        STRING_SEQUENCE,
        MIXED_SEQUENCE
    }

    private final Kind kind;
    private final List<Object> values;

    private BucketKey(Kind kind, List<Object> values) {
        this.kind = kind;
        this.values = Collections.unmodifiableList(values);
    }

    public static BucketKey scalar(Object value) {
        Objects.requireNonNull(value, "bucket key value");
        return new BucketKey(Kind.SCALAR, Collections.singletonList(keyValue(value)));
    }

    public static BucketKey strings(List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Bucket key sequence cannot be empty");
        }
        return new BucketKey(Kind.STRING_SEQUENCE, new ArrayList<>(values));
    }

    public static BucketKey strings(String... values) {
        List<String> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return strings(list);
    }

    public static BucketKey mixed(List<?> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Bucket key sequence cannot be empty");
        }
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(keyValue(value));
        }
        return new BucketKey(Kind.MIXED_SEQUENCE, normalized);
    }

    /**
     * Numbers that render the same must compare equal, so an integral double becomes a Long.
     */
    private static Object keyValue(Object value) {
        Number n = Numbers.normalize(value);
        if (n == null) {
            return value;
        }
        if (n instanceof Double) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return (long) d;
            }
        }
        return n;
    }

    public Kind getKind() {
        return kind;
    }

    public List<Object> getValues() {
        return values;
    }

    /**
     * Group-by values for an output row: strings as-is, other scalars in canonical text form.
     */
    public List<String> render() {
        List<String> rendered = new ArrayList<>(values.size());
        for (Object value : values) {
            rendered.add(value instanceof String ? (String) value : Numbers.toCanonicalString(value));
        }
        return rendered;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BucketKey that = (BucketKey) o;
        return kind == that.kind && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, values);
    }

    @Override
    public String toString() {
        return kind == Kind.SCALAR ? String.valueOf(values.get(0)) : values.toString();
    }
}
