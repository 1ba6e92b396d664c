package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the file behind each cell for one radix.
 * <p>
 * Single pass over the directory listing. The first entry whose captured prefix equals the
 * radix fills a cell; later matches for a filled cell are ignored, so with duplicate matches
 * the listing order decides.
 */
public class FileResolver {

    private static final Logger log = LoggerFactory.getLogger(FileResolver.class);

    private final DirectoryLister lister;
    private final CellPatternCompiler compiler;

    public FileResolver(DirectoryLister lister, CellPatternCompiler compiler) {
        this.lister = lister;
        this.compiler = compiler;
    }

    /**
     * Resolve one file per cell for the given radix.
     *
     * @param directory    Directory holding the images
     * @param radix        Radix selected for display
     * @param cellPatterns Cells in display order; malformed patterns leave their cell empty
     * @return One entry per cell, same order; empty where nothing matched or the directory
     * could not be read
     */
    public List<Optional<Path>> resolve(Path directory, String radix, List<CellPattern> cellPatterns) {
        List<Optional<Path>> slots = new ArrayList<>(cellPatterns.size());
        for (int i = 0; i < cellPatterns.size(); i++) {
            slots.add(Optional.empty());
        }
        List<Optional<CompiledCellPattern>> compiled = compiler.compileAll(cellPatterns);

        List<String> entries;
        try {
            entries = lister.list(directory);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot list directory {}: {}", directory, e.getMessage());
            return slots;
        }

        for (String name : entries) {
            for (int cell = 0; cell < compiled.size(); cell++) {
                if (slots.get(cell).isPresent() || compiled.get(cell).isEmpty()) {
                    continue;
                }
                Optional<String> captured = compiled.get(cell).get().captureRadix(name);
                if (captured.isPresent() && captured.get().equals(radix)) {
                    slots.set(cell, Optional.of(directory.resolve(name)));
                    log.debug("Radix '{}' cell {} → {}", radix, cell, name);
                }
            }
        }
        return slots;
    }
}
