package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import com.largomodo.imagereview.core.domain.ExtractionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CellPatternCompilerTest {

    private final CellPatternCompiler compiler = new CellPatternCompiler();
    private final PatternExtractor extractor = new PatternExtractor(compiler);

    @Test
    void testPatternMatchesDifferentRadix() {
        ExtractionResult result = extractor.extract(List.of("shot_001_diffuse.jpg", "shot_001_specular.jpg")).orElseThrow();

        CompiledCellPattern diffuse = compiler.compile(result.cellPatterns().get(0).pattern());
        assertEquals(Optional.of("shot_042"), diffuse.captureRadix("shot_042_diffuse.jpg"));
    }

    @Test
    void testPatternMatchesMixedExtension() {
        ExtractionResult result = extractor.extract(
                List.of("shot_001.jpg", "shot_001_diffuse.tiff", "shot_001_specular.jpeg")).orElseThrow();

        CompiledCellPattern diffuse = compiler.compile(result.cellPatterns().get(1).pattern());
        assertEquals(Optional.of("shot_042"), diffuse.captureRadix("shot_042_diffuse.tiff"));
        assertTrue(diffuse.captureRadix("shot_042_diffuse.tif").isEmpty());
    }

    @Test
    void testPatternRejectsUnrelatedFile() {
        ExtractionResult result = extractor.extract(List.of("shot_001_diffuse.jpg", "shot_001_specular.jpg")).orElseThrow();

        CompiledCellPattern diffuse = compiler.compile(result.cellPatterns().get(0).pattern());
        assertTrue(diffuse.captureRadix("photo_holiday.png").isEmpty());
        assertTrue(diffuse.captureRadix("shot_042_specular.jpg").isEmpty());
    }

    @Test
    void testDotIsLiteral() {
        CompiledCellPattern jpg = compiler.compile(compiler.patternForTail(".jpg"));

        assertEquals(Optional.of("shot_001"), jpg.captureRadix("shot_001.jpg"));
        assertTrue(jpg.captureRadix("shot_001xjpg").isEmpty(), "Escaped dot must not match any character");
    }

    @Test
    void testMetacharacterTailRoundTrip() {
        String tail = "_copy (1)+[final].png";
        CompiledCellPattern pattern = compiler.compile(compiler.patternForTail(tail));

        assertEquals(Optional.of("IMG_0042"), pattern.captureRadix("IMG_0042" + tail));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\n", "\r\n", "\r", "\u0085", "\u2028", "\u2029"})
    void testTrailingLineTerminatorDoesNotMatch(String terminator) {
        ExtractionResult result = extractor.extract(List.of("shot_001_diffuse.jpg", "shot_001_specular.jpg")).orElseThrow();

        CompiledCellPattern diffuse = compiler.compile(result.cellPatterns().get(0).pattern());
        assertTrue(diffuse.captureRadix("shot_002_diffuse.jpg" + terminator).isEmpty());
        assertEquals(Optional.of("shot_002"), diffuse.captureRadix("shot_002_diffuse.jpg"));
    }

    @Test
    void testEmptyRadixCaptured() {
        CompiledCellPattern pattern = compiler.compile(compiler.patternForTail("_diffuse.jpg"));
        assertEquals(Optional.of(""), pattern.captureRadix("_diffuse.jpg"));
    }

    @Test
    void testHandEditedPatternWithoutAnchorsSearches() {
        CompiledCellPattern pattern = compiler.compile("(shot_\\d+)_diff");

        assertEquals(Optional.of("shot_007"), pattern.captureRadix("shot_007_diffuse.jpg"));
    }

    @Test
    void testPatternWithoutCaptureGroupYieldsNothing() {
        CompiledCellPattern pattern = compiler.compile("_diffuse\\.jpg$");

        assertTrue(pattern.captureRadix("shot_001_diffuse.jpg").isEmpty());
    }

    @Test
    void testNonParticipatingGroupYieldsNothing() {
        CompiledCellPattern pattern = compiler.compile("^(?:(shot_\\d+)_a|other)\\.jpg$");

        assertEquals(Optional.of("shot_1"), pattern.captureRadix("shot_1_a.jpg"));
        assertTrue(pattern.captureRadix("other.jpg").isEmpty());
    }

    @Test
    void testMalformedPatternThrows() {
        MalformedCellPatternException ex = assertThrows(MalformedCellPatternException.class,
                () -> compiler.compile("^(.*_diffuse\\.jpg$"));
        assertTrue(ex.getMessage().contains("^(.*_diffuse\\.jpg$"));
        assertNotNull(ex.getCause());

        assertThrows(MalformedCellPatternException.class, () -> compiler.compile(null));
    }

    @Test
    void testCompileAllKeepsPositions() {
        List<CellPattern> cells = List.of(
                new CellPattern("diffuse", "_diffuse.jpg", "^(.*)_diffuse\\.jpg$"),
                new CellPattern("broken", "", "^(.*"),
                new CellPattern("specular", "_specular.jpg", "^(.*)_specular\\.jpg$"));

        List<Optional<CompiledCellPattern>> compiled = compiler.compileAll(cells);

        assertEquals(3, compiled.size());
        assertTrue(compiled.get(0).isPresent());
        assertTrue(compiled.get(1).isEmpty(), "Malformed pattern should leave an empty slot");
        assertTrue(compiled.get(2).isPresent());
        assertEquals("^(.*)_specular\\.jpg$", compiled.get(2).get().source());
    }
}
