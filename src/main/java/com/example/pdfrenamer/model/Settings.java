package com.example.pdfrenamer.model;

import java.nio.file.Path;

/**
 * Effective user settings: directories, the persisted extraction rectangle and
 * the digit filter.
 */
public record Settings(Path inputDir, Path outputDir, Path logDir, ExtractionRect rect, DigitFilter digitFilter) {

    public Settings withRect(ExtractionRect replacement) {
        return new Settings(inputDir, outputDir, logDir, replacement, digitFilter);
    }
}
