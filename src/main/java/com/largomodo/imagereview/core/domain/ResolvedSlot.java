package com.largomodo.imagereview.core.domain;

import java.nio.file.Path;

/**
 * A display slot paired with the file that should be loaded into it.
 *
 * @param index Cell index, aligned with the session's cell patterns
 * @param path  Absolute path of the resolved file
 */
public record ResolvedSlot(int index, Path path) {

    public ResolvedSlot {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
    }
}
