package com.example.pdfrenamer.service.recognition;

/**
 * The recognition backend could not produce text at all, as opposed to
 * producing text without digits.
 */
public class RecognitionUnavailableException extends Exception {

    public RecognitionUnavailableException(String message) {
        super(message);
    }

    public RecognitionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
