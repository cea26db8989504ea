package com.github.salilvnair.entityflow.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public final class TextUtil {

    /** Collapse whitespace; title-case text typed entirely in lower or upper case. */
    public static String normalizeName(String raw) {
        if (raw == null) {
            return "";
        }
        String collapsed = raw.trim().replaceAll("\\s+", " ");
        if (collapsed.isEmpty()) {
            return collapsed;
        }
        boolean allLower = collapsed.equals(collapsed.toLowerCase(Locale.ROOT));
        boolean allUpper = collapsed.equals(collapsed.toUpperCase(Locale.ROOT));
        return allLower || allUpper ? titleCase(collapsed) : collapsed;
    }

    public static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            out.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = Character.isWhitespace(c);
        }
        return out.toString();
    }

    public static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    public static String asText(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
