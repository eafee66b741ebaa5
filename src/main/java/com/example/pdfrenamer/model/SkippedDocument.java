package com.example.pdfrenamer.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Document that was passed over without producing output")
public record SkippedDocument(
        @Schema(description = "File name of the skipped document", example = "scan_0003.pdf") String fileName,
        @Schema(description = "Why the document was skipped") String reason) {
}
