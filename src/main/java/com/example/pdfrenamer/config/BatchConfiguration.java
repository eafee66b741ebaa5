package com.example.pdfrenamer.config;

import com.example.pdfrenamer.model.Settings;
import com.example.pdfrenamer.service.batch.BatchPipeline;
import com.example.pdfrenamer.service.batch.DocumentQueue;
import com.example.pdfrenamer.service.document.DocumentSource;
import com.example.pdfrenamer.service.extraction.RegionExtractor;
import com.example.pdfrenamer.service.log.IdentifierLogWriter;
import com.example.pdfrenamer.service.settings.SettingsStore;
import com.example.pdfrenamer.util.PreviewTransform.PreviewGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class BatchConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BatchConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SettingsStore settingsStore(RenamerProperties properties) {
        return new SettingsStore(Paths.get(properties.getSettingsFile()));
    }

    @Bean
    public Settings settings(SettingsStore settingsStore) {
        Settings settings = settingsStore.load();
        settingsStore.ensureDirectories(settings);
        return settings;
    }

    @Bean
    public DocumentQueue documentQueue(Settings settings, RenamerProperties properties) {
        try {
            DocumentQueue queue = DocumentQueue.scan(settings.inputDir(), properties.getDocumentExtension());
            if (queue.isEmpty()) {
                log.info("No {} files found in {}", properties.getDocumentExtension(), settings.inputDir());
            } else {
                log.info("Queued {} documents from {}", queue.size(), settings.inputDir());
            }
            return queue;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to list input directory " + settings.inputDir(), e);
        }
    }

    @Bean
    public IdentifierLogWriter identifierLogWriter(Settings settings, Clock clock) {
        return new IdentifierLogWriter(settings.logDir(), clock);
    }

    @Bean
    public BatchPipeline batchPipeline(DocumentQueue documentQueue,
                                       Settings settings,
                                       DocumentSource documentSource,
                                       RegionExtractor regionExtractor,
                                       SettingsStore settingsStore,
                                       IdentifierLogWriter identifierLogWriter,
                                       RenamerProperties properties) {
        PreviewGeometry geometry = new PreviewGeometry(
                properties.getPreviewMargin(),
                properties.getPreviewMinimumSize(),
                properties.getPreviewFallbackWidth(),
                properties.getPreviewFallbackHeight());
        return new BatchPipeline(documentQueue, settings, documentSource, regionExtractor,
                settingsStore, identifierLogWriter, geometry);
    }
}
