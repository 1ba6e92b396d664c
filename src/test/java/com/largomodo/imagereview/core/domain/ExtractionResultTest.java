package com.largomodo.imagereview.core.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionResultTest {

    private static final CellPattern DIFFUSE =
            new CellPattern("diffuse", "_diffuse.jpg", "^(.*)_diffuse\\.jpg$");
    private static final CellPattern SPECULAR =
            new CellPattern("specular", "_specular.jpg", "^(.*)_specular\\.jpg$");

    @Test
    void testValidResult() {
        ExtractionResult result = new ExtractionResult("shot_001", List.of(DIFFUSE, SPECULAR));

        assertEquals("shot_001", result.radix());
        assertEquals(List.of(DIFFUSE, SPECULAR), result.cellPatterns());
    }

    @Test
    void testCellPatternsDefensivelyCopied() {
        List<CellPattern> cells = new ArrayList<>(List.of(DIFFUSE));
        ExtractionResult result = new ExtractionResult("shot_001", cells);
        cells.add(SPECULAR);

        assertEquals(1, result.cellPatterns().size(), "Later edits to the source list must not leak in");
        assertThrows(UnsupportedOperationException.class, () -> result.cellPatterns().add(SPECULAR));
    }

    @Test
    void testEmptyRadixRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionResult("", List.of(DIFFUSE)));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionResult(null, List.of(DIFFUSE)));
    }

    @Test
    void testDuplicateTailsRejected() {
        CellPattern sameTail = new CellPattern("other", "_diffuse.jpg", "^(.*)x$");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new ExtractionResult("shot_001", List.of(DIFFUSE, sameTail)));
        assertTrue(ex.getMessage().contains("_diffuse.jpg"));
    }

    @Test
    void testCellPatternWithPatternKeepsDisplayFields() {
        CellPattern edited = DIFFUSE.withPattern("^(.*)_diff\\.png$");

        assertEquals("diffuse", edited.label());
        assertEquals("_diffuse.jpg", edited.tail());
        assertEquals("^(.*)_diff\\.png$", edited.pattern());
        assertThrows(IllegalArgumentException.class, () -> DIFFUSE.withPattern(null));
    }
}
