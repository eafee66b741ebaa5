package com.example.pdfrenamer.service.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Documents of one run, sorted by file name. Built once and never changed,
 * even if files appear in or disappear from the input directory later.
 */
public final class DocumentQueue {

    private final List<Path> documents;

    public DocumentQueue(List<Path> documents) {
        this.documents = List.copyOf(documents);
    }

    public static DocumentQueue scan(Path inputDir, String extension) throws IOException {
        String suffix = extension.toLowerCase(Locale.ROOT);
        try (Stream<Path> files = Files.list(inputDir)) {
            List<Path> documents = files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
            return new DocumentQueue(documents);
        }
    }

    public Path get(int index) {
        return documents.get(index);
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public List<Path> documents() {
        return documents;
    }
}
