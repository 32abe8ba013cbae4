package com.lyshra.open.desk.core.util;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public final class CommonUtil {

    private CommonUtil() {
    }

    public static boolean isNullOrBlank(final String str) {
        return str == null || str.trim().isEmpty();
    }

    public static boolean isNotBlank(final String str) {
        return str != null && !str.trim().isEmpty();
    }

    public static <T> boolean isNullOrEmpty(final Collection<T> collection) {
        return collection == null || collection.isEmpty();
    }

    public static <T> boolean isNotEmpty(final Collection<T> collection) {
        return collection != null && !collection.isEmpty();
    }

    public static <T> List<T> nonNullList(List<T> list) {
        return Optional.ofNullable(list).orElse(Collections.emptyList());
    }

    public static <K, V> Map<K, V> nonNullMap(Map<K, V> map) {
        return Optional.ofNullable(map).orElse(Collections.emptyMap());
    }

    public static boolean patternMatches(Pattern pattern, String input) {
        boolean matches = false;
        if (CommonUtil.isNotBlank(input)) {
            matches = pattern.matcher(input).matches();
        }
        return matches;
    }

    /**
     * Path segment for a document type: lower case, spaces to dashes, other non-word characters dropped.
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).replace(' ', '-').replaceAll("[^\\w-]+", "");
    }
}
