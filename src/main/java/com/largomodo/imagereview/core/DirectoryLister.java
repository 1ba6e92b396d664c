package com.largomodo.imagereview.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over reading a directory's entry names.
 * <p>
 * Core package depends on this interface, service package provides the filesystem
 * implementation. Tests substitute an in-memory listing.
 */
public interface DirectoryLister {

    /**
     * List the names of a directory's immediate entries (no recursion).
     *
     * @param directory Directory to read
     * @return Entry names without the directory part, in listing order
     * @throws IOException if the directory is missing or cannot be read
     */
    List<String> list(Path directory) throws IOException;
}
