package com.example.pdfrenamer.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(description = "Size of the preview area reported by the client")
public record LayoutRequest(
        @Schema(description = "Preview area width in pixels", example = "900") @PositiveOrZero double width,
        @Schema(description = "Preview area height in pixels", example = "1100") @PositiveOrZero double height) {
}
