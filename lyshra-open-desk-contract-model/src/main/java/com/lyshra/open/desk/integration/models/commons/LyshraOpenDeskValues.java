package com.lyshra.open.desk.integration.models.commons;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Value coercions shared by the models and the engine, following the server's
 * {@code cstr}/{@code cint} conventions.
 */
public final class LyshraOpenDeskValues {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private LyshraOpenDeskValues() {
    }

    public static String cstr(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }

    public static int cint(Object value) {
        return cint(value, 0);
    }

    /**
     * Booleans map to 1/0, numbers are truncated, strings yield their leading integer.
     * Anything else gives {@code defaultValue}.
     */
    public static int cint(Object value, int defaultValue) {
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return defaultValue;
            }
            return (int) d;
        }
        Matcher matcher = LEADING_INTEGER.matcher(cstr(value));
        if (!matcher.find()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * {@code null}, {@code false}, zero, NaN, the empty string and empty collections are falsy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence chars) {
            return chars.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Object[] array) {
            return array.length > 0;
        }
        return true;
    }

    /**
     * Missing for mandatory checks: {@code null}, blank strings and empty collections. Zero is a value.
     */
    public static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence chars) {
            return chars.toString().trim().isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Object[] array) {
            return array.length == 0;
        }
        return false;
    }
}
