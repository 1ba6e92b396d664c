package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Discovers the radixes of every comparable set in a directory.
 * <p>
 * Each entry name is evaluated against every cell pattern; a captured prefix is a candidate
 * radix, corroborated by the cell that captured it. Candidates are kept only when at least
 * {@code min(cellCount, 2)} distinct cells corroborate them. A broad single rule such as
 * {@code ^(.*)\.jpg$} would otherwise turn every JPEG in the directory into its own set.
 * <p>
 * An unreadable directory yields no radixes (logged, not thrown).
 */
public class DirectoryScanner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanner.class);

    private final DirectoryLister lister;
    private final CellPatternCompiler compiler;

    public DirectoryScanner(DirectoryLister lister, CellPatternCompiler compiler) {
        this.lister = lister;
        this.compiler = compiler;
    }

    /**
     * Scan a directory for radixes matching the given cells.
     *
     * @param directory    Directory holding the images
     * @param cellPatterns Cells in display order; malformed patterns are skipped
     * @return Distinct radixes in lexicographic order (empty if the directory cannot be read)
     */
    public List<String> scan(Path directory, List<CellPattern> cellPatterns) {
        List<Optional<CompiledCellPattern>> compiled = compiler.compileAll(cellPatterns);

        List<String> entries;
        try {
            entries = lister.list(directory);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot list directory {}: {}", directory, e.getMessage());
            return List.of();
        }

        // radix → indices of the cells that captured it
        Map<String, BitSet> corroboration = new HashMap<>();
        for (String name : entries) {
            for (int cell = 0; cell < compiled.size(); cell++) {
                Optional<CompiledCellPattern> pattern = compiled.get(cell);
                if (pattern.isEmpty()) {
                    continue;
                }
                Optional<String> radix = pattern.get().captureRadix(name);
                if (radix.isPresent()) {
                    corroboration.computeIfAbsent(radix.get(), k -> new BitSet()).set(cell);
                }
            }
        }

        int minCells = Math.min(cellPatterns.size(), 2);
        TreeSet<String> radixes = new TreeSet<>();
        corroboration.forEach((radix, cells) -> {
            if (cells.cardinality() >= minCells) {
                radixes.add(radix);
            }
        });

        log.debug("Scanned {} entries in {}: {} candidates, {} radixes",
                entries.size(), directory, corroboration.size(), radixes.size());
        return List.copyOf(radixes);
    }
}
