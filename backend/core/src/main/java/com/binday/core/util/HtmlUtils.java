package com.binday.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private HtmlUtils() {
    }

    /**
     * Collapses every whitespace run (including non-breaking spaces) into a single space and trims.
     */
    public static String normalizeSpaces(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.replace('\u00a0', ' ')).replaceAll(" ").trim();
    }

    public static String slugify(String value) {
        String lowered = normalizeSpaces(value).toLowerCase(Locale.ROOT);
        String slug = NON_ALPHANUMERIC.matcher(lowered).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    public static String titleCase(String value) {
        String normalized = normalizeSpaces(value);
        if (normalized.isEmpty()) {
            return "Collection";
        }
        StringBuilder out = new StringBuilder(normalized.length());
        for (String word : normalized.split(" ")) {
            if (out.length() > 0) {
                out.append(' ');
            }
            int first = word.codePointAt(0);
            int firstLength = Character.charCount(first);
            out.appendCodePoint(Character.toUpperCase(first));
            out.append(word.substring(firstLength).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }
}
