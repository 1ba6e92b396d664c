package com.largomodo.imagereview.core;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A cell pattern ready for evaluation against directory entry names.
 * <p>
 * Immutable; {@link Pattern} is thread-safe and a fresh {@link Matcher} is created per call.
 */
public final class CompiledCellPattern {

    private final String source;
    private final Pattern regex;

    CompiledCellPattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    /**
     * The pattern text this instance was compiled from.
     */
    public String source() {
        return source;
    }

    /**
     * Extract the radix a filename would have if it belonged to this cell.
     * <p>
     * Uses find() rather than matches(): generated patterns are anchored anyway, and a
     * hand-edited pattern without anchors still behaves as a search.
     *
     * @param filename Directory entry name (no path)
     * @return Text captured by group 1, or empty if the name does not match or the
     * pattern has no participating group 1
     */
    public Optional<String> captureRadix(String filename) {
        Matcher matcher = regex.matcher(filename);
        if (!matcher.find() || matcher.groupCount() < 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(matcher.group(1));
    }

    @Override
    public String toString() {
        return source;
    }
}
