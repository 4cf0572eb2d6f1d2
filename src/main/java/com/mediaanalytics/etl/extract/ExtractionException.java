package com.mediaanalytics.etl.extract;

import java.nio.file.Path;

/**
 * The input directory itself could not be read. Unreadable files inside it are skipped, not raised.
 */
public class ExtractionException extends RuntimeException {
    private final Path directory;

    public ExtractionException(Path directory, Throwable cause) {
        super("Failed to list input directory " + directory + ": " + cause.getMessage(), cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
