package com.example.pdfrenamer.service.document;

/**
 * Raised when a single document cannot be opened, rendered or read. The batch
 * skips the document and carries on with the next one.
 */
public class DocumentProcessingException extends RuntimeException {

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
