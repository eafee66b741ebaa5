package com.example.pdfrenamer.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Rectangle on the first page of a document, in document-space units (PDF
 * points, origin in the top-left corner). Instances are immutable and a
 * recalibration replaces the active rectangle instead of mutating it.
 */
@Schema(description = "Extraction rectangle in document-space units")
public record ExtractionRect(
        @Schema(description = "Left edge", example = "50") double x0,
        @Schema(description = "Top edge", example = "50") double y0,
        @Schema(description = "Right edge", example = "250") double x1,
        @Schema(description = "Bottom edge", example = "100") double y1) {

    public static final ExtractionRect DEFAULT = fromOrigin(50, 50, 200, 50);

    public ExtractionRect {
        if (!(x0 < x1)) {
            throw new IllegalArgumentException("Extraction rectangle must have x0 < x1");
        }
        if (!(y0 < y1)) {
            throw new IllegalArgumentException("Extraction rectangle must have y0 < y1");
        }
    }

    public static ExtractionRect fromOrigin(double x, double y, double width, double height) {
        return new ExtractionRect(x, y, x + width, y + height);
    }

    public double width() {
        return x1 - x0;
    }

    public double height() {
        return y1 - y0;
    }
}
