package com.mediaanalytics.etl.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An input file that was skipped during extraction, and why.
 */
public class ExtractionWarning {
    private final Path file;
    private final String reason;

    public ExtractionWarning(Path file, String reason) {
        this.file = file;
        this.reason = reason;
    }

    public Path getFile() {
        return file;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionWarning)) return false;
        ExtractionWarning that = (ExtractionWarning) o;
        return Objects.equals(file, that.file) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, reason);
    }

    @Override
    public String toString() {
        return file + ": " + reason;
    }
}
