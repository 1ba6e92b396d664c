package com.largomodo.imagereview.util;

/**
 * Escapes literal text for embedding in {@code java.util.regex} patterns.
 * <p>
 * Unlike {@link java.util.regex.Pattern#quote(String)}, which wraps the text in
 * {@code \Q...\E}, each metacharacter gets its own backslash. The output stays readable
 * when shown to a user for hand editing: "_diffuse.jpg" → "_diffuse\.jpg".
 */
public class RegexLiterals {

    private static final String METACHARACTERS = "\\.[]{}()<>*+-=!?^$|&~#";

    private RegexLiterals() {
        // Static utility class - prevent instantiation
    }

    /**
     * Escape every regex metacharacter in {@code literal}.
     * <p>
     * Only non-alphabetic characters are ever prefixed with a backslash, which
     * {@code java.util.regex} always reads as the literal character.
     *
     * @param literal Text to match verbatim
     * @return Pattern fragment matching exactly {@code literal}
     * @throws IllegalArgumentException if literal is null
     */
    public static String escape(String literal) {
        if (literal == null) {
            throw new IllegalArgumentException("Literal cannot be null");
        }
        StringBuilder escaped = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (METACHARACTERS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
