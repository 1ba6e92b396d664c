package com.largomodo.imagereview.core.domain;

/**
 * One variant (display cell) of a comparable image set.
 * <p>
 * Only {@code pattern} takes part in matching. {@code label} and {@code tail} are display
 * bookkeeping: after a manual edit they are carried over from the previous extraction,
 * or left as a placeholder, and no longer have to agree with {@code pattern}.
 * </p>
 *
 * @param label   Human-readable variant name ("diffuse", "v2", "jpg")
 * @param tail    Exact suffix following the radix in the sample filename ("_diffuse.jpg")
 * @param pattern Regex whose capture group 1 yields the radix of a matching filename
 */
public record CellPattern(String label, String tail, String pattern) {

    public CellPattern {
        if (label == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        if (tail == null) {
            throw new IllegalArgumentException("tail must not be null");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }
    }

    /**
     * Copy of this cell with a user-edited pattern, keeping label and tail.
     */
    public CellPattern withPattern(String editedPattern) {
        return new CellPattern(label, tail, editedPattern);
    }
}
