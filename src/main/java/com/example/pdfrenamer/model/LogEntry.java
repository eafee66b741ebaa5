package com.example.pdfrenamer.model;

import java.time.LocalDate;

public record LogEntry(LocalDate date, String identifier) {
}
