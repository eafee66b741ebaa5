package com.example.pdfrenamer.model.api;

import com.example.pdfrenamer.model.ExtractionRect;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Settings in effect for this run")
public record SettingsResponse(
        @Schema(description = "Settings file location") String settingsFile,
        @Schema(description = "Directory the documents are read from") String inputDir,
        @Schema(description = "Directory renamed copies are written to") String outputDir,
        @Schema(description = "Directory holding the daily log files") String logDir,
        @Schema(description = "Required digit count, 0 when disabled", example = "13") int digits,
        @Schema(description = "Rectangle loaded at startup") ExtractionRect loadedRect,
        @Schema(description = "Rectangle currently used for extraction") ExtractionRect activeRect) {
}
