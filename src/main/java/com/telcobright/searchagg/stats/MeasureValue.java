package com.telcobright.searchagg.stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Final value of one measure: an integer, a float, a string or a list of strings.
 */
public final class MeasureValue {

    public enum Type {
        SIGNED_NUM,
        FLOAT,
        STRING,
        STRING_LIST
    }

    private final Type type;
    private final Object value;

    private MeasureValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static MeasureValue ofLong(long value) {
        return new MeasureValue(Type.SIGNED_NUM, value);
    }

    public static MeasureValue ofDouble(double value) {
        return new MeasureValue(Type.FLOAT, value);
    }

    public static MeasureValue ofNumber(Number number) {
        Number normalized = Numbers.normalize(number);
        if (normalized instanceof Long) {
            return ofLong(normalized.longValue());
        }
        return ofDouble(normalized.doubleValue());
    }

    public static MeasureValue ofString(String value) {
        return new MeasureValue(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static MeasureValue ofStrings(List<String> values) {
        return new MeasureValue(Type.STRING_LIST, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public Type getType() {
        return type;
    }

    /**
     * Raw value: Long, Double, String or {@code List<String>} depending on {@link #getType()}.
     */
    public Object getValue() {
        return value;
    }

    public boolean isNumeric() {
        return type == Type.SIGNED_NUM || type == Type.FLOAT;
    }

    public Number asNumber() {
        if (!isNumeric()) {
            throw new IllegalStateException("Measure value of type " + type + " is not numeric");
        }
        return (Number) value;
    }

    @SuppressWarnings("unchecked")
    public List<String> asStrings() {
        if (type == Type.STRING_LIST) {
            return (List<String>) value;
        }
        return Collections.singletonList(asString(", "));
    }

    /**
     * Renders the value as one string; list entries are joined with {@code separator}.
     */
    @SuppressWarnings("unchecked")
    public String asString(String separator) {
        switch (type) {
            case SIGNED_NUM:
            case FLOAT:
                return Numbers.toCanonicalString(value);
            case STRING:
                return (String) value;
            case STRING_LIST:
                return String.join(separator, (List<String>) value);
            default:
                throw new IllegalStateException("Unknown measure value type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MeasureValue that = (MeasureValue) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
