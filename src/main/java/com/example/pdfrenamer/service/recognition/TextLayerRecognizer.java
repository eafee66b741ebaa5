package com.example.pdfrenamer.service.recognition;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.service.document.PagedDocument;

import java.io.IOException;

/**
 * Reads the embedded text layer instead of running OCR. Only useful for
 * documents that were produced digitally.
 */
public class TextLayerRecognizer implements TextRecognizer {

    @Override
    public String recognize(PagedDocument document, ExtractionRect region) throws IOException {
        return document.firstPageTextWithin(region);
    }
}
