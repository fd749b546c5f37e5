package com.telcobright.searchagg.stats;

import java.math.BigDecimal;

/**
 * Arithmetic over the two numeric shapes statistics carry: {@code Long} for integral values
 * and {@code Double} for everything else. Mixed operands promote to {@code Double}.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Converts any boxed number to Long or Double; returns null for non-numbers.
     */
    public static Number normalize(Object value) {
        if (value instanceof Long || value instanceof Double) {
            return (Number) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return null;
    }

    public static boolean isNumber(Object value) {
        return normalize(value) != null;
    }

    public static Number add(Number a, Number b) {
        if (a == null) return normalize(b);
        if (b == null) return normalize(a);
        if (isFloating(a) || isFloating(b)) {
            return a.doubleValue() + b.doubleValue();
        }
        return a.longValue() + b.longValue();
    }

    public static Number subtract(Number a, Number b) {
        if (isFloating(a) || isFloating(b)) {
            return a.doubleValue() - b.doubleValue();
        }
        return a.longValue() - b.longValue();
    }

    public static Number min(Number a, Number b) {
        if (a == null) return normalize(b);
        if (b == null) return normalize(a);
        return compare(b, a) < 0 ? normalize(b) : normalize(a);
    }

    public static Number max(Number a, Number b) {
        if (a == null) return normalize(b);
        if (b == null) return normalize(a);
        return compare(b, a) > 0 ? normalize(b) : normalize(a);
    }

    public static int compare(Number a, Number b) {
        if (isFloating(a) || isFloating(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return Long.compare(a.longValue(), b.longValue());
    }

    public static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float || n instanceof BigDecimal;
    }

    /**
     * Canonical text of a scalar: integral doubles print without a fraction,
     * other doubles print in plain (non-scientific) notation.
     */
    public static String toCanonicalString(Object value) {
        if (value == null) {
            return "";
        }
        Number number = normalize(value);
        if (number == null) {
            return value.toString();
        }
        if (number instanceof Long) {
            return number.toString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
