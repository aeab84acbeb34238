package com.example.accessgate.common.util;

import org.springframework.lang.NonNull;

/**
 * Cache key component handling.
 */
public final class CacheKeyUtils {

    public static final char SEPARATOR = ':';

    private static final char ESCAPE = '_';
    private static final String ABSENT = "-";

    private CacheKeyUtils() {}

    /**
     * Encodes a key component so that it can neither forge another key nor widen a pattern scan.
     * The separator, whitespace, glob metacharacters and the escape character itself become
     * {@code _} followed by four hex digits, so distinct components always encode differently.
     *
     * @throws IllegalArgumentException if the component is null or blank
     */
    @NonNull
    public static String encode(String component) {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("Cache key component cannot be null or blank");
        }
        if (ABSENT.equals(component)) {
            return escape(component.charAt(0));
        }
        StringBuilder sb = null;
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (isReserved(c)) {
                if (sb == null) {
                    sb = new StringBuilder(component.length() + 8).append(component, 0, i);
                }
                sb.append(escape(c));
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? component : sb.toString();
    }

    /**
     * Like {@link #encode} but maps null or blank to {@code -}. A literal {@code -} component is
     * escaped, so the two never meet.
     */
    @NonNull
    public static String encodeOptional(String component) {
        return component == null || component.isBlank() ? ABSENT : encode(component);
    }

    private static boolean isReserved(char c) {
        return c == ESCAPE || c == SEPARATOR || c == '*' || c == '?' || c == '[' || c == ']'
                || c == '\\' || Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static String escape(char c) {
        return ESCAPE + String.format("%04x", (int) c);
    }
}
