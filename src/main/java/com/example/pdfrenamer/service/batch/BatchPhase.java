package com.example.pdfrenamer.service.batch;

public enum BatchPhase {
    IDLE,
    DISPLAYING,
    CALIBRATING,
    DONE
}
