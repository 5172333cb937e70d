package com.kingsfoil.kingsfoil.source;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison form of a raw header text: trimmed, internal whitespace collapsed, upper case.
 */
public final class HeaderNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private HeaderNormalizer() {
    }

    public static String normalize(String header) {
        if (header == null) {
            return "";
        }
        String stripped = header.replace("\uFEFF", "").strip();
        return WHITESPACE.matcher(stripped).replaceAll(" ").toUpperCase(Locale.ROOT);
    }
}
