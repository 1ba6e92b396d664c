package com.largomodo.imagereview.util;

/**
 * Separator rules shared by pattern extraction and label derivation.
 * <p>
 * The characters {@code _ - .} delimit words in render and capture filenames
 * (e.g. {@code shot_001_diffuse.jpg}, {@code img-001-left.png}). Everything else is
 * treated as part of a word.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class FilenameSeparators {

    private static final String SEPARATORS = "_-.";

    private FilenameSeparators() {
        // Static utility class - prevent instantiation
    }

    public static boolean isSeparator(char c) {
        return SEPARATORS.indexOf(c) >= 0;
    }

    public static boolean endsWithSeparator(String s) {
        return !s.isEmpty() && isSeparator(s.charAt(s.length() - 1));
    }

    /**
     * Remove every trailing separator: "shot_001__" → "shot_001".
     */
    public static String trimTrailing(String s) {
        int end = s.length();
        while (end > 0 && isSeparator(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    /**
     * Remove every leading separator: "_diffuse.jpg" → "diffuse.jpg".
     */
    public static String trimLeading(String s) {
        int start = 0;
        while (start < s.length() && isSeparator(s.charAt(start))) {
            start++;
        }
        return s.substring(start);
    }

    /**
     * Index of the last separator character in {@code s}, or -1 if there is none.
     */
    public static int lastSeparatorIndex(String s) {
        for (int i = s.length() - 1; i >= 0; i--) {
            if (isSeparator(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Derive a display label from the variant suffix of a filename.
     * <p>
     * Strategy: strip leading separators, then split on the LAST dot so that
     * "_beauty.v2.exr" → "beauty.v2". A suffix that is only an extension (".jpg")
     * has nothing before the dot, so the extension itself becomes the label ("jpg").
     *
     * @param tail Variant suffix as it appears after the radix (may be empty)
     * @return Human-readable label, empty only when the tail holds nothing but separators
     */
    public static String deriveLabel(String tail) {
        String stripped = trimLeading(tail);
        int lastDot = stripped.lastIndexOf('.');
        if (lastDot < 0) {
            return stripped;
        }
        String withoutExtension = stripped.substring(0, lastDot);
        if (withoutExtension.isEmpty()) {
            return stripped.substring(lastDot + 1);
        }
        return withoutExtension;
    }
}
