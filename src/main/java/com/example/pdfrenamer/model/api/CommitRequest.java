package com.example.pdfrenamer.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Commit of the displayed document")
public record CommitRequest(
        @Schema(description = "Identifier to save under; the current filename field is used when omitted", example = "123456") String filename,
        @Schema(description = "Confirms replacing an existing file with the same name") boolean overwrite) {
}
