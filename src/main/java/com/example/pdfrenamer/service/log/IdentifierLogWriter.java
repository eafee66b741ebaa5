package com.example.pdfrenamer.service.log;

import com.example.pdfrenamer.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Append-only record of committed identifiers, one file per calendar day named
 * {@code yyyyMMdd.txt}, one identifier per line in commit order.
 */
public class IdentifierLogWriter {

    private static final Logger log = LoggerFactory.getLogger(IdentifierLogWriter.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String EXTENSION = ".txt";

    private final Path logDir;
    private final Clock clock;

    public IdentifierLogWriter(Path logDir, Clock clock) {
        this.logDir = logDir;
        this.clock = clock;
    }

    public LogEntry append(String identifier) throws IOException {
        LocalDate today = LocalDate.now(clock);
        Path logFile = fileFor(today);
        Files.createDirectories(logDir);
        Files.writeString(logFile, identifier + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND,
                StandardOpenOption.SYNC);
        log.debug("Appended '{}' to {}", identifier, logFile);
        return new LogEntry(today, identifier);
    }

    public List<LogEntry> read(LocalDate date) throws IOException {
        Path logFile = fileFor(date);
        if (!Files.exists(logFile)) {
            return List.of();
        }
        return Files.readAllLines(logFile, StandardCharsets.UTF_8).stream()
                .filter(line -> !line.isEmpty())
                .map(line -> new LogEntry(date, line))
                .toList();
    }

    public Path fileFor(LocalDate date) {
        return logDir.resolve(date.format(FILE_DATE) + EXTENSION);
    }
}
