package com.leyesmx.application.conversion;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the base identifier of a source file: the first run of 3 to 6 digits in the
 * file name stem ({@code clean_0008.txt} → {@code 0008}), or the stem without its
 * {@code clean_} prefix when there is none.
 */
public final class DocumentIds {

    private static final Pattern BASE_DIGITS = Pattern.compile("(?<!\\d)\\d{3,6}(?!\\d)");

    private static final String CLEAN_PREFIX = "clean_";

    private DocumentIds() {}

    public static String baseId(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;

        Matcher m = BASE_DIGITS.matcher(stem);
        if (m.find()) {
            return m.group();
        }
        return stem.startsWith(CLEAN_PREFIX) ? stem.substring(CLEAN_PREFIX.length()) : stem;
    }
}
