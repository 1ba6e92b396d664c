package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import com.largomodo.imagereview.util.RegexLiterals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds and compiles the textual match rules stored in {@link CellPattern}.
 * <p>
 * Patterns travel as plain strings so the user can edit them and have the edit take effect
 * on the next scan. Generated rules have the shape {@code ^(.*)<escaped tail>\z}: group 1
 * captures everything before the literal tail. {@code \z} anchors at the very end of the name;
 * {@code $} would also accept a trailing line terminator.
 * <p>
 * Stateless. Safe for concurrent use.
 */
public class CellPatternCompiler {

    private static final Logger log = LoggerFactory.getLogger(CellPatternCompiler.class);

    /**
     * Build the match rule for a variant suffix.
     *
     * @param tail Exact suffix following the radix ("_diffuse.jpg")
     * @return Anchored rule capturing the prefix before {@code tail}
     */
    public String patternForTail(String tail) {
        return "^(.*)" + RegexLiterals.escape(tail) + "\\z";
    }

    /**
     * Compile pattern text.
     *
     * @param patternText Generated or hand-edited rule
     * @return Compiled pattern
     * @throws MalformedCellPatternException if the text is not a valid regular expression
     */
    public CompiledCellPattern compile(String patternText) {
        if (patternText == null) {
            throw new MalformedCellPatternException("Pattern must not be null");
        }
        try {
            return new CompiledCellPattern(patternText, Pattern.compile(patternText));
        } catch (PatternSyntaxException e) {
            throw new MalformedCellPatternException(
                    "Invalid pattern '" + patternText + "': " + e.getDescription(), e);
        }
    }

    /**
     * Compile every cell, keeping positions aligned with the input.
     * <p>
     * A malformed pattern is logged and leaves an empty slot so the remaining cells still
     * participate in scanning and resolving.
     *
     * @param cellPatterns Cells in display order
     * @return One entry per cell; empty where the pattern did not compile
     */
    public List<Optional<CompiledCellPattern>> compileAll(List<CellPattern> cellPatterns) {
        List<Optional<CompiledCellPattern>> compiled = new ArrayList<>(cellPatterns.size());
        for (CellPattern cell : cellPatterns) {
            try {
                compiled.add(Optional.of(compile(cell.pattern())));
            } catch (MalformedCellPatternException e) {
                log.warn("Skipping cell '{}': {}", cell.label(), e.getMessage());
                compiled.add(Optional.empty());
            }
        }
        return compiled;
    }
}
