package com.largomodo.imagereview.core;

import com.largomodo.imagereview.core.domain.ResolvedSlot;

import java.nio.file.Path;
import java.util.List;

/**
 * Observer interface for review-mode navigation events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only the
 * events they care about.
 * </p>
 *
 * @see ReviewNavigator
 */
public interface ReviewObserver {

    /**
     * Called after a directory scan rebuilt the radix list.
     *
     * @param directory the scanned directory
     * @param radixes   discovered radixes, sorted
     */
    default void onRadixesScanned(Path directory, List<String> radixes) {}

    /**
     * Called after the files of the current radix were resolved.
     *
     * @param radix the radix now on display
     * @param slots cells that resolved to a file; unresolved cells are absent
     */
    default void onSlotsResolved(String radix, List<ResolvedSlot> slots) {}

    /**
     * Called when activation fails and leaves the previous state in place.
     *
     * @param message human-readable reason, also stored in the review state
     */
    default void onReviewError(String message) {}
}
