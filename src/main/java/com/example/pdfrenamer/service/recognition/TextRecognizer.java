package com.example.pdfrenamer.service.recognition;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.service.document.PagedDocument;

import java.io.IOException;

/**
 * Produces the text found inside a rectangle of a document's first page.
 * Implementations can run OCR on the rendered region or read the embedded text
 * layer.
 */
public interface TextRecognizer {

    /**
     * @return recognized text, empty when nothing was found
     * @throws IOException                     if the document itself cannot be read
     * @throws RecognitionUnavailableException if the backend is missing or fails
     */
    String recognize(PagedDocument document, ExtractionRect region) throws IOException, RecognitionUnavailableException;
}
