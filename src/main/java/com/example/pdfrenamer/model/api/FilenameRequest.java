package com.example.pdfrenamer.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

public record FilenameRequest(
        @Schema(description = "New value of the filename field, without extension", example = "123456") @NotNull String filename) {
}
