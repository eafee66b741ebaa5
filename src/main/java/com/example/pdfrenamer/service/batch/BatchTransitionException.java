package com.example.pdfrenamer.service.batch;

/**
 * The requested action is not available in the current state of the batch,
 * e.g. a commit before the first document is displayed.
 */
public class BatchTransitionException extends RuntimeException {

    public BatchTransitionException(String message) {
        super(message);
    }
}
