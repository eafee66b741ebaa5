package com.example.pdfrenamer.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Drag gesture over the preview, in preview pixels")
public record CalibrationRequest(
        @Schema(description = "X where the drag started", example = "120") double startX,
        @Schema(description = "Y where the drag started", example = "80") double startY,
        @Schema(description = "X where the drag was released", example = "320") double endX,
        @Schema(description = "Y where the drag was released", example = "140") double endY) {
}
