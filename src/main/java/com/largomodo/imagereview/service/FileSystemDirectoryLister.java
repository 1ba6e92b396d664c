package com.largomodo.imagereview.service;

import com.largomodo.imagereview.core.DirectoryLister;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads entry names from the local filesystem with a single flat directory stream.
 * <p>
 * Subdirectories are listed like any other entry; pattern matching decides relevance.
 * Order is whatever the platform returns.
 */
public class FileSystemDirectoryLister implements DirectoryLister {

    @Override
    public List<String> list(Path directory) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                names.add(entry.getFileName().toString());
            }
        } catch (DirectoryIteratorException e) {
            // Iteration failure mid-listing surfaces as unchecked; unwrap to the declared type
            throw e.getCause();
        }
        return names;
    }
}
