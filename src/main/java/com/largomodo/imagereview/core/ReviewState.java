package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import com.largomodo.imagereview.core.domain.ExtractionResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Mutable review-mode state owned by the caller (viewer UI or CLI).
 * <p>
 * Passed explicitly into every {@link ReviewNavigator} operation; the navigator keeps no
 * state of its own. Collections are replaced wholesale, never edited in place.
 * <p>
 * Not thread-safe: one state object per viewer.
 */
public class ReviewState {

    private Path directory;
    private ExtractionResult extraction;
    private List<CellPattern> cellPatterns = List.of();
    private List<String> radixes = List.of();
    private int currentIndex;
    private String errorMessage;

    public ReviewState() {
    }

    /**
     * State for a directory whose patterns will be supplied by hand, without extraction.
     */
    public ReviewState(Path directory) {
        this.directory = directory;
    }

    public Optional<Path> getDirectory() {
        return Optional.ofNullable(directory);
    }

    void setDirectory(Path directory) {
        this.directory = directory;
    }

    /**
     * Last successful extraction, kept after manual pattern edits.
     */
    public Optional<ExtractionResult> getExtraction() {
        return Optional.ofNullable(extraction);
    }

    void setExtraction(ExtractionResult extraction) {
        this.extraction = extraction;
    }

    /**
     * Cells currently used for scanning: the extracted ones, or the user's edits.
     */
    public List<CellPattern> getCellPatterns() {
        return cellPatterns;
    }

    void setCellPatterns(List<CellPattern> cellPatterns) {
        this.cellPatterns = List.copyOf(cellPatterns);
    }

    public List<String> getRadixes() {
        return radixes;
    }

    void setRadixes(List<String> radixes) {
        this.radixes = List.copyOf(radixes);
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    /**
     * Radix at the current index, or empty when no radix has been discovered.
     */
    public Optional<String> getCurrentRadix() {
        if (radixes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(radixes.get(currentIndex));
    }

    /**
     * Message from the last failed activation; cleared by the next successful one.
     */
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
