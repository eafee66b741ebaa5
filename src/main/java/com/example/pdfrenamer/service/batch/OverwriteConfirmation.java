package com.example.pdfrenamer.service.batch;

import java.nio.file.Path;

/**
 * Asked before a commit replaces an existing file in the output directory.
 */
@FunctionalInterface
public interface OverwriteConfirmation {

    OverwriteConfirmation DECLINE = target -> false;
    OverwriteConfirmation ACCEPT = target -> true;

    boolean confirmOverwrite(Path target);
}
