package com.example.pdfrenamer.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.List;

@Schema(description = "Identifiers committed on one day")
public record LogResponse(
        @Schema(description = "Day of the log file", example = "2024-05-01") LocalDate date,
        @Schema(description = "Committed identifiers in commit order") List<String> identifiers) {
}
