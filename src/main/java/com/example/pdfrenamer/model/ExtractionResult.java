package com.example.pdfrenamer.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Candidate identifier read from the extraction rectangle")
public record ExtractionResult(
        @Schema(description = "Text returned by the recognition backend", example = "No. 12-3456 AB") String rawText,
        @Schema(description = "Digits concatenated in reading order", example = "123456") String candidate,
        @Schema(description = "Whether the candidate satisfies the digit filter") boolean valid,
        @Schema(description = "Value used to seed the filename field", example = "123456") String displayValue) {
}
