package com.example.pdfrenamer.service.settings;

public class SettingsPersistenceException extends RuntimeException {

    public SettingsPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
