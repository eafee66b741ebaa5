package com.example.pdfrenamer.service.batch;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.SkippedDocument;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Read-only view of the batch after the last transition")
public record BatchSnapshot(
        @Schema(description = "Current phase of the batch", example = "DISPLAYING") BatchPhase phase,
        @Schema(description = "Zero-based position of the displayed document", example = "0") int index,
        @Schema(description = "Number of documents in the queue", example = "12") int total,
        @Schema(description = "File name of the displayed document", example = "scan_0001.pdf") String documentName,
        @Schema(description = "Status line for the user", example = "processing: scan_0001.pdf (1/12)") String statusText,
        @Schema(description = "Text returned by the recognition backend") String rawText,
        @Schema(description = "Digits read from the extraction region", example = "123456") String candidate,
        @Schema(description = "Whether the candidate satisfies the digit filter") boolean candidateValid,
        @Schema(description = "Current value of the filename field", example = "123456") String filename,
        @Schema(description = "Recognition backend failure for this document, if any") String recognitionError,
        @Schema(description = "Active extraction rectangle in document space") ExtractionRect rect,
        @Schema(description = "Incremented on every recalibration", example = "0") int rectVersion,
        @Schema(description = "Whether the active rectangle has been written to the settings file") boolean rectSaved,
        @Schema(description = "Active extraction rectangle in preview space") PreviewRegion previewRect,
        @Schema(description = "Preview pixels per document unit", example = "1.2") double scaleFactor,
        @Schema(description = "Horizontal offset of the page image inside the preview area") double offsetX,
        @Schema(description = "Vertical offset of the page image inside the preview area") double offsetY,
        @Schema(description = "Width of the rendered page image in pixels") int imageWidth,
        @Schema(description = "Height of the rendered page image in pixels") int imageHeight,
        @Schema(description = "Last message for the user") String message,
        @Schema(description = "Documents passed over so far") List<SkippedDocument> skipped) {

    public record PreviewRegion(double x0, double y0, double x1, double y1) {
    }
}
