package com.largomodo.imagereview.core.domain;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable outcome of inferring a naming convention from sample filenames.
 * <p>
 * Created once per activation from the filenames currently on display. Replaced as a
 * whole, never mutated.
 * </p>
 *
 * @param radix        Shared identifying prefix of the sample set ("shot_001"), non-empty
 * @param cellPatterns One pattern per sample filename, in display order (unmodifiable)
 */
public record ExtractionResult(String radix, List<CellPattern> cellPatterns) {

    /**
     * Compact constructor enforcing a non-empty radix and pairwise distinct tails.
     *
     * @throws IllegalArgumentException if radix is empty or two cells share a tail
     */
    public ExtractionResult {
        if (radix == null || radix.isEmpty()) {
            throw new IllegalArgumentException("radix must not be null or empty");
        }
        cellPatterns = List.copyOf(cellPatterns);

        Set<String> tails = new HashSet<>();
        for (CellPattern cell : cellPatterns) {
            if (!tails.add(cell.tail())) {
                throw new IllegalArgumentException("Duplicate tail: '" + cell.tail() + "'");
            }
        }
    }
}
