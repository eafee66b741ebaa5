package com.example.pdfrenamer.controller;

import com.example.pdfrenamer.model.Settings;
import com.example.pdfrenamer.model.api.SettingsResponse;
import com.example.pdfrenamer.service.batch.BatchPipeline;
import com.example.pdfrenamer.service.settings.SettingsStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@Tag(name = "Settings")
public class SettingsController {

    private final Settings settings;
    private final SettingsStore settingsStore;
    private final BatchPipeline pipeline;

    public SettingsController(Settings settings, SettingsStore settingsStore, BatchPipeline pipeline) {
        this.settings = settings;
        this.settingsStore = settingsStore;
        this.pipeline = pipeline;
    }

    @GetMapping
    @Operation(summary = "Settings in effect for this run")
    public ResponseEntity<SettingsResponse> settings() {
        return ResponseEntity.ok(new SettingsResponse(
                settingsStore.location().toString(),
                settings.inputDir().toString(),
                settings.outputDir().toString(),
                settings.logDir().toString(),
                settings.digitFilter().digits(),
                settings.rect(),
                pipeline.activeRect()));
    }
}
