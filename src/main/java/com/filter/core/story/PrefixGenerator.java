package com.filter.core.story;

import java.util.Locale;

/**
 * Derives a story id prefix from a project name.
 *
 * <p>Trailing separators and digits are dropped, remaining non-alphanumerics removed, and the
 * first five characters kept, padded with {@code x}: {@code "ibstreams-2"} becomes {@code "ibstr"},
 * {@code "api"} becomes {@code "apixx"}.
 */
public final class PrefixGenerator {

    static final int LENGTH = 5;

    private PrefixGenerator() {}

    public static String generate(String projectName) {
        if (projectName == null) {
            projectName = "";
        }
        String clean = projectName.toLowerCase(Locale.ROOT)
                .replaceAll("[-_\\d]+$", "")
                .replaceAll("[^a-z0-9]", "");
        if (clean.length() >= LENGTH) {
            return clean.substring(0, LENGTH);
        }
        return clean + "x".repeat(LENGTH - clean.length());
    }

    public static boolean isValid(String prefix) {
        return prefix != null && prefix.matches("[A-Za-z0-9]{1,16}");
    }
}
