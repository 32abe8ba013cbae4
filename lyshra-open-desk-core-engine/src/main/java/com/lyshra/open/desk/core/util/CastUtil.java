package com.lyshra.open.desk.core.util;

import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loose-typing conversions used by the expression interpreter. {@code null} stands for both
 * {@code null} and {@code undefined}.
 */
public final class CastUtil {

    private CastUtil() {}

    public static boolean castAsBoolean(Object e) {
        return LyshraOpenDeskValues.isTruthy(e);
    }

    public static double castAsNumber(Object e) {
        if (e == null) {
            return 0;
        }
        if (e instanceof Number number) {
            return number.doubleValue();
        }
        if (e instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (e instanceof CharSequence chars) {
            String s = chars.toString().trim();
            if (s.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException ex) {
                return Double.NaN;
            }
        }
        if (e instanceof Collection<?> collection) {
            if (collection.isEmpty()) {
                return 0;
            }
            return collection.size() == 1 ? castAsNumber(collection.iterator().next()) : Double.NaN;
        }
        return Double.NaN;
    }

    public static String castAsString(Object e) {
        if (e == null) {
            return "null";
        }
        if (e instanceof String string) {
            return string;
        }
        if (e instanceof Number number) {
            return numberToString(number.doubleValue());
        }
        if (e instanceof Collection<?> collection) {
            return collection.stream()
                    .map(item -> item == null ? "" : castAsString(item))
                    .collect(Collectors.joining(","));
        }
        if (e instanceof Map<?, ?>) {
            return "[object Object]";
        }
        return e.toString();
    }

    public static String numberToString(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    public static boolean isPrimitive(Object e) {
        return e == null || e instanceof String || e instanceof Number || e instanceof Boolean;
    }

    public static boolean strictEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        if (a instanceof String || a instanceof Boolean) {
            return a.equals(b);
        }
        return a == b;
    }

    /**
     * Equality with type coercion: numbers, strings and booleans compare numerically when their types differ.
     */
    public static boolean looseEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number
                || a instanceof String && b instanceof String
                || a instanceof Boolean && b instanceof Boolean) {
            return strictEquals(a, b);
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            return looseEquals(a instanceof Boolean ? castAsNumber(a) : a, b instanceof Boolean ? castAsNumber(b) : b);
        }
        if (isPrimitive(a) && isPrimitive(b)) {
            return castAsNumber(a) == castAsNumber(b);
        }
        if (isPrimitive(a) != isPrimitive(b)) {
            Object primitive = isPrimitive(a) ? a : b;
            Object object = isPrimitive(a) ? b : a;
            return looseEquals(primitive, castAsString(object));
        }
        return a == b;
    }

    /**
     * Relational comparison; strings compare lexicographically, everything else numerically.
     * Returns {@code null} when the operands are not comparable (a NaN is involved).
     */
    public static Integer compare(Object a, Object b) {
        if (a instanceof String x && b instanceof String y) {
            return Integer.signum(x.compareTo(y));
        }
        double x = castAsNumber(a);
        double y = castAsNumber(b);
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return null;
        }
        return x < y ? -1 : (x == y ? 0 : 1);
    }
}
