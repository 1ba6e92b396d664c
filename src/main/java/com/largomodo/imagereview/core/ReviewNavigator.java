package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.CellPattern;
import com.largomodo.imagereview.core.domain.ExtractionResult;
import com.largomodo.imagereview.core.domain.ResolvedSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Review-mode orchestrator: activation, manual pattern edits, refresh and paging.
 * <p>
 * Coordinates the pipeline:
 * 1. Infer radix and cell patterns from the images on display (PatternExtractor)
 * 2. Discover every radix in the directory (DirectoryScanner)
 * 3. Resolve the files of the selected radix (FileResolver)
 * <p>
 * Holds no state between calls: everything lives in the {@link ReviewState} passed in.
 * Activation failures are recorded as a message and never thrown.
 */
public class ReviewNavigator {

    static final String INSUFFICIENT_IMAGES = "Need at least 2 displayed images to infer a pattern";
    static final String NO_COMMON_PATTERN = "No common naming pattern found";

    private static final Logger log = LoggerFactory.getLogger(ReviewNavigator.class);

    private final PatternExtractor extractor;
    private final DirectoryScanner scanner;
    private final FileResolver resolver;
    private final ReviewObserver observer;

    public ReviewNavigator(PatternExtractor extractor, DirectoryScanner scanner,
                           FileResolver resolver, ReviewObserver observer) {
        this.extractor = extractor;
        this.scanner = scanner;
        this.resolver = resolver;
        this.observer = observer;
    }

    /**
     * Infer the naming pattern from the displayed images and scan their directory.
     * <p>
     * On failure the error message is set and the rest of the state is left untouched.
     *
     * @param state              Review state to update
     * @param directory          Parent directory shared by the displayed images
     * @param displayedFilenames Basenames in display-slot order
     * @return Resolved slots for the selected radix (empty on failure)
     */
    public List<ResolvedSlot> activate(ReviewState state, Path directory, List<String> displayedFilenames) {
        if (displayedFilenames.size() < 2) {
            return fail(state, INSUFFICIENT_IMAGES);
        }

        Optional<ExtractionResult> extraction = extractor.extract(displayedFilenames);
        if (extraction.isEmpty()) {
            return fail(state, NO_COMMON_PATTERN);
        }

        ExtractionResult result = extraction.get();
        state.setErrorMessage(null);
        state.setDirectory(directory);
        state.setExtraction(result);
        state.setCellPatterns(result.cellPatterns());
        rescan(state, result.radix());

        log.debug("Activated review on radix '{}' with {} cells", result.radix(), result.cellPatterns().size());
        return resolveCurrent(state);
    }

    /**
     * Replace the cell patterns with user-edited text and rescan.
     * <p>
     * Edits are positional. Labels and tails are carried over from the previous cell at the
     * same position; cells beyond the previous count get a "cell N" label and an empty tail.
     *
     * @param state        Review state to update (must already know its directory)
     * @param patternTexts Edited pattern text, one per cell
     * @return Resolved slots for the selected radix
     * @throws IllegalStateException if the state has no directory yet
     */
    public List<ResolvedSlot> applyEditedPatterns(ReviewState state, List<String> patternTexts) {
        requireDirectory(state);

        List<CellPattern> previous = state.getCellPatterns();
        List<CellPattern> edited = new ArrayList<>(patternTexts.size());
        for (int i = 0; i < patternTexts.size(); i++) {
            String text = patternTexts.get(i);
            if (i < previous.size()) {
                edited.add(previous.get(i).withPattern(text));
            } else {
                edited.add(new CellPattern("cell " + (i + 1), "", text));
            }
        }
        state.setCellPatterns(edited);

        rescan(state, state.getCurrentRadix().orElse(null));
        return resolveCurrent(state);
    }

    /**
     * Rescan with the current patterns, keeping the selected radix when it still exists.
     *
     * @throws IllegalStateException if the state has no directory yet
     */
    public List<ResolvedSlot> refresh(ReviewState state) {
        requireDirectory(state);
        rescan(state, state.getCurrentRadix().orElse(null));
        return resolveCurrent(state);
    }

    /**
     * Move through the known radix list without rescanning.
     *
     * @param state Review state to update
     * @param step  Signed offset (usually +1 / -1); wraps around both ends
     * @return Resolved slots for the new radix, empty when no radix is known
     */
    public List<ResolvedSlot> navigate(ReviewState state, int step) {
        List<String> radixes = state.getRadixes();
        if (radixes.isEmpty()) {
            return List.of();
        }
        int size = radixes.size();
        state.setCurrentIndex((state.getCurrentIndex() + Math.floorMod(step, size)) % size);
        return resolveCurrent(state);
    }

    /**
     * Jump to a specific known radix.
     *
     * @throws IllegalArgumentException if the radix is not in the current radix list
     */
    public List<ResolvedSlot> select(ReviewState state, String radix) {
        int index = state.getRadixes().indexOf(radix);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown radix: " + radix);
        }
        state.setCurrentIndex(index);
        return resolveCurrent(state);
    }

    private List<ResolvedSlot> fail(ReviewState state, String message) {
        log.debug("Review activation failed: {}", message);
        state.setErrorMessage(message);
        observer.onReviewError(message);
        return List.of();
    }

    private void requireDirectory(ReviewState state) {
        if (state.getDirectory().isEmpty()) {
            throw new IllegalStateException("Review state has no directory; activate review first");
        }
    }

    private void rescan(ReviewState state, String preferredRadix) {
        Path directory = state.getDirectory().orElseThrow();
        List<String> radixes = scanner.scan(directory, state.getCellPatterns());
        state.setRadixes(radixes);
        int index = preferredRadix == null ? -1 : radixes.indexOf(preferredRadix);
        state.setCurrentIndex(Math.max(index, 0));
        observer.onRadixesScanned(directory, radixes);
    }

    private List<ResolvedSlot> resolveCurrent(ReviewState state) {
        Optional<String> radix = state.getCurrentRadix();
        if (radix.isEmpty()) {
            return List.of();
        }

        List<Optional<Path>> files = resolver.resolve(
                state.getDirectory().orElseThrow(), radix.get(), state.getCellPatterns());
        List<ResolvedSlot> slots = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            int cell = i;
            files.get(i).ifPresent(path -> slots.add(new ResolvedSlot(cell, path.toAbsolutePath())));
        }

        observer.onSlotsResolved(radix.get(), slots);
        return List.copyOf(slots);
    }
}
