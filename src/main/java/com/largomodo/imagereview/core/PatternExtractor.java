package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import com.largomodo.imagereview.core.domain.ExtractionResult;
import com.largomodo.imagereview.util.FilenameSeparators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Infers the naming convention shared by a set of filenames shown side by side.
 * <p>
 * Pipeline:
 * 1. Longest common prefix (LCP) of all filenames
 * 2. Move the prefix to a separator boundary to get the radix
 * 3. Per filename: tail = text after the radix, label and match rule derived from the tail
 * 4. Reject the result if two tails collide
 * <p>
 * Example: "shot_001_diffuse.jpg" + "shot_001_specular.jpg" → radix "shot_001",
 * tails "_diffuse.jpg" / "_specular.jpg".
 * <p>
 * Stateless. Safe for concurrent use.
 */
public class PatternExtractor {

    private static final Logger log = LoggerFactory.getLogger(PatternExtractor.class);

    private final CellPatternCompiler compiler;

    public PatternExtractor() {
        this(new CellPatternCompiler());
    }

    public PatternExtractor(CellPatternCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * Extract radix and per-cell patterns from sample filenames.
     *
     * @param filenames Basenames (no directories) in display-slot order
     * @return Extraction result, or empty if fewer than 2 filenames were given, the names
     * share no usable prefix, or two names leave identical tails
     */
    public Optional<ExtractionResult> extract(List<String> filenames) {
        if (filenames == null || filenames.size() < 2) {
            return Optional.empty();
        }

        String prefix = longestCommonPrefix(filenames);
        if (prefix.isEmpty()) {
            log.debug("No common prefix in {}", filenames);
            return Optional.empty();
        }

        String radix = radixBoundary(prefix, filenames);
        if (radix.isEmpty()) {
            log.debug("Common prefix '{}' has no separator boundary", prefix);
            return Optional.empty();
        }

        List<CellPattern> cells = new ArrayList<>(filenames.size());
        Set<String> tails = new HashSet<>();
        for (String filename : filenames) {
            String tail = filename.substring(radix.length());
            if (!tails.add(tail)) {
                log.debug("Duplicate tail '{}' for radix '{}'", tail, radix);
                return Optional.empty();
            }
            cells.add(new CellPattern(
                    FilenameSeparators.deriveLabel(tail),
                    tail,
                    compiler.patternForTail(tail)));
        }

        log.debug("Extracted radix '{}' with tails {}", radix, tails);
        return Optional.of(new ExtractionResult(radix, cells));
    }

    /**
     * Character-wise longest common prefix.
     * <p>
     * Never ends between the two halves of a surrogate pair.
     */
    static String longestCommonPrefix(List<String> strings) {
        String first = strings.get(0);
        int length = first.length();
        for (int s = 1; s < strings.size(); s++) {
            String other = strings.get(s);
            length = Math.min(length, other.length());
            for (int i = 0; i < length; i++) {
                if (first.charAt(i) != other.charAt(i)) {
                    length = i;
                    break;
                }
            }
        }
        if (length > 0 && Character.isHighSurrogate(first.charAt(length - 1))) {
            length--;
        }
        return first.substring(0, length);
    }

    /**
     * Decide where the radix ends inside the common prefix.
     * <p>
     * Three cases, checked in order:
     * - prefix ends with separators ("shot_001_"): they belong to the tails, trim them
     * - every filename continues with a word character ("frame001_v" from v1/v2): the prefix
     *   stops mid-word, back up to the last separator inside it ("frame001")
     * - otherwise at least one filename continues with a separator or ends: the prefix is
     *   the radix as-is
     *
     * @return Radix, or empty string if no boundary exists
     */
    static String radixBoundary(String prefix, List<String> filenames) {
        if (FilenameSeparators.endsWithSeparator(prefix)) {
            return FilenameSeparators.trimTrailing(prefix);
        }

        boolean midWord = filenames.stream().allMatch(name ->
                name.length() > prefix.length()
                        && !FilenameSeparators.isSeparator(name.charAt(prefix.length())));

        if (midWord) {
            int lastSeparator = FilenameSeparators.lastSeparatorIndex(prefix);
            return lastSeparator < 0 ? "" : prefix.substring(0, lastSeparator);
        }

        return prefix;
    }
}
