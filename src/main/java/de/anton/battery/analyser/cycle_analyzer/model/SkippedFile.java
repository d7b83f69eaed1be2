package de.anton.battery.analyser.cycle_analyzer.model;

import java.util.Objects;

/**
 * A workbook that could not be read; the remaining files of the folder were still processed.
 */
public record SkippedFile(String fileName, String reason) {
    public SkippedFile {
        Objects.requireNonNull(fileName, "File name cannot be null.");
    }
}
