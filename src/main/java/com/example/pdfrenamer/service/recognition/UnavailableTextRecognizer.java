package com.example.pdfrenamer.service.recognition;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.service.document.PagedDocument;

/**
 * Stands in for the OCR backend when it could not be configured at startup, so
 * every extraction reports the problem instead of returning empty text.
 */
public class UnavailableTextRecognizer implements TextRecognizer {

    private final String reason;

    public UnavailableTextRecognizer(String reason) {
        this.reason = reason;
    }

    @Override
    public String recognize(PagedDocument document, ExtractionRect region) throws RecognitionUnavailableException {
        throw new RecognitionUnavailableException(reason);
    }
}
