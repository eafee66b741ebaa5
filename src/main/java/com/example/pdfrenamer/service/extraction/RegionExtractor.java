package com.example.pdfrenamer.service.extraction;

import com.example.pdfrenamer.model.DigitFilter;
import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.ExtractionResult;
import com.example.pdfrenamer.service.document.PagedDocument;
import com.example.pdfrenamer.service.recognition.RecognitionUnavailableException;
import com.example.pdfrenamer.service.recognition.TextRecognizer;
import com.example.pdfrenamer.util.IdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Reads the candidate identifier from the extraction rectangle of a document's
 * first page. A candidate that fails the digit filter is still returned, with
 * its display value prefixed by the invalid marker so that it cannot be
 * committed unchanged.
 */
public class RegionExtractor {

    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    private final TextRecognizer recognizer;
    private final String invalidPrefix;

    public RegionExtractor(TextRecognizer recognizer, String invalidPrefix) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        if (invalidPrefix == null || invalidPrefix.isBlank()) {
            throw new IllegalArgumentException("Invalid prefix must not be blank");
        }
        this.invalidPrefix = invalidPrefix;
    }

    public ExtractionResult extract(PagedDocument document, ExtractionRect rect, DigitFilter digitFilter)
            throws IOException, RecognitionUnavailableException {
        String rawText = recognizer.recognize(document, rect);
        String candidate = IdentifierNormalizer.digitsOnly(rawText);
        boolean valid = digitFilter.accepts(candidate);
        String displayValue = valid ? candidate : invalidPrefix + candidate;
        log.debug("Extracted candidate '{}' (valid={}) from {}", candidate, valid, document.fileName());
        return new ExtractionResult(rawText, candidate, valid, displayValue);
    }

    /**
     * Marker that a filename must not start with to be committed.
     */
    public String invalidMarker() {
        return invalidPrefix.strip();
    }
}
