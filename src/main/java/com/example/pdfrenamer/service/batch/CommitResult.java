package com.example.pdfrenamer.service.batch;

public record CommitResult(CommitOutcome outcome, BatchSnapshot snapshot) {
}
