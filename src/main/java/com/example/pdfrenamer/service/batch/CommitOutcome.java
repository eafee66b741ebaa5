package com.example.pdfrenamer.service.batch;

public enum CommitOutcome {
    /** Document copied, identifier logged, cursor advanced. */
    COMMITTED,
    /** Filename empty, marked invalid or not usable as a file name. */
    REJECTED,
    /** Target exists and overwriting was not confirmed. */
    OVERWRITE_NOT_CONFIRMED,
    /** Commit was requested during calibration and only ended calibration. */
    CALIBRATION_EXITED,
    /** Copying or logging failed; nothing advanced. */
    FAILED
}
