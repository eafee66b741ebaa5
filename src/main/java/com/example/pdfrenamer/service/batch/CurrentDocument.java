package com.example.pdfrenamer.service.batch;

import com.example.pdfrenamer.model.ExtractionResult;
import com.example.pdfrenamer.model.PageSize;
import com.example.pdfrenamer.util.PreviewTransform;

import java.nio.file.Path;

/**
 * Working state of the displayed document. {@code extraction} is null when the
 * recognition backend failed, in which case {@code recognitionError} says why
 * and the filename field starts empty.
 */
public record CurrentDocument(
        Path path,
        PageSize pageSize,
        PreviewTransform transform,
        ExtractionResult extraction,
        String filename,
        String recognitionError) {

    public String fileName() {
        return path.getFileName().toString();
    }

    public CurrentDocument withFilename(String replacement) {
        return new CurrentDocument(path, pageSize, transform, extraction, replacement, recognitionError);
    }

    public CurrentDocument withTransform(PreviewTransform replacement) {
        return new CurrentDocument(path, pageSize, replacement, extraction, filename, recognitionError);
    }

    public CurrentDocument withExtraction(ExtractionResult result) {
        return new CurrentDocument(path, pageSize, transform, result, result.displayValue(), null);
    }

    public CurrentDocument withRecognitionError(String error) {
        return new CurrentDocument(path, pageSize, transform, null, "", error);
    }
}
