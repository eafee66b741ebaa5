package com.example.pdfrenamer.controller;

import com.example.pdfrenamer.model.LogEntry;
import com.example.pdfrenamer.model.api.LogResponse;
import com.example.pdfrenamer.service.log.IdentifierLogWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;

@RestController
@RequestMapping("/api/log")
@Tag(name = "Log", description = "Identifiers committed per day")
public class LogController {

    private final IdentifierLogWriter logWriter;
    private final Clock clock;

    public LogController(IdentifierLogWriter logWriter, Clock clock) {
        this.logWriter = logWriter;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "Identifiers committed on a given day")
    public ResponseEntity<LogResponse> entries(
            @Parameter(description = "Day as yyyyMMdd, today when omitted", example = "20240501")
            @RequestParam(name = "date", required = false) String date) {
        LocalDate day = parseDate(date);
        try {
            return ResponseEntity.ok(new LogResponse(day, logWriter.read(day).stream()
                    .map(LogEntry::identifier)
                    .toList()));
        } catch (IOException ex) {
            throw new ResponseStatusException(INTERNAL_SERVER_ERROR, "Failed to read log for " + day, ex);
        }
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(date.trim(), DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Date must be formatted as yyyyMMdd", ex);
        }
    }
}
