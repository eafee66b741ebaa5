package com.example.pdfrenamer.service.batch;

import com.example.pdfrenamer.model.Coordinate;
import com.example.pdfrenamer.model.DigitFilter;
import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.ExtractionResult;
import com.example.pdfrenamer.model.PageSize;
import com.example.pdfrenamer.model.Settings;
import com.example.pdfrenamer.model.SkippedDocument;
import com.example.pdfrenamer.service.document.DocumentProcessingException;
import com.example.pdfrenamer.service.document.DocumentSource;
import com.example.pdfrenamer.service.document.PagedDocument;
import com.example.pdfrenamer.service.extraction.RegionExtractor;
import com.example.pdfrenamer.service.log.IdentifierLogWriter;
import com.example.pdfrenamer.service.recognition.RecognitionUnavailableException;
import com.example.pdfrenamer.service.settings.SettingsPersistenceException;
import com.example.pdfrenamer.service.settings.SettingsStore;
import com.example.pdfrenamer.util.PreviewTransform;
import com.example.pdfrenamer.util.PreviewTransform.PreviewGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Drives the queue one document at a time: display and extract, let the user
 * confirm or edit the identifier, then copy the document under that name and
 * log it. Every public method is one transition and runs under a single lock,
 * so requests from different threads are serialized.
 */
public class BatchPipeline implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);
    private static final String FORBIDDEN_FILENAME_CHARS = "\\/:*?\"<>|";

    private final Object lock = new Object();
    private final DocumentQueue queue;
    private final DocumentSource documentSource;
    private final RegionExtractor extractor;
    private final SettingsStore settingsStore;
    private final IdentifierLogWriter logWriter;
    private final Path outputDir;
    private final DigitFilter digitFilter;
    private final PreviewGeometry geometry;
    private final List<SkippedDocument> skipped = new ArrayList<>();

    private BatchState state = new BatchState.Idle();
    private ExtractionRect rect;
    private int rectVersion;
    private boolean rectSaved = true;
    private double previewWidth;
    private double previewHeight;
    private PagedDocument openDocument;
    private BufferedImage preview;
    private String message;

    public BatchPipeline(DocumentQueue queue,
                         Settings settings,
                         DocumentSource documentSource,
                         RegionExtractor extractor,
                         SettingsStore settingsStore,
                         IdentifierLogWriter logWriter,
                         PreviewGeometry geometry) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.documentSource = Objects.requireNonNull(documentSource, "documentSource");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore");
        this.logWriter = Objects.requireNonNull(logWriter, "logWriter");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.outputDir = settings.outputDir();
        this.digitFilter = settings.digitFilter();
        this.rect = settings.rect();
    }

    /**
     * Reports the size of the preview area. The first call starts the batch;
     * later calls refit the displayed page.
     */
    public BatchSnapshot layoutReady(double width, double height) {
        synchronized (lock) {
            previewWidth = width;
            previewHeight = height;
            if (state instanceof BatchState.Idle) {
                log.info("Preview area ready ({}x{}), starting batch of {} documents", width, height, queue.size());
                displayFrom(0);
            } else if (state instanceof BatchState.Displaying displaying) {
                refit(displaying.index(), displaying.document(), false);
            } else if (state instanceof BatchState.Calibrating calibrating) {
                refit(calibrating.index(), calibrating.document(), true);
            }
            return snapshotLocked();
        }
    }

    public BatchSnapshot snapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    public BatchState state() {
        synchronized (lock) {
            return state;
        }
    }

    public ExtractionRect activeRect() {
        synchronized (lock) {
            return rect;
        }
    }

    /**
     * @return the first page of the displayed document, rendered at the preview scale
     */
    public BufferedImage preview() {
        synchronized (lock) {
            if (preview == null || currentDocument() == null) {
                throw new BatchTransitionException("No document is displayed");
            }
            return preview;
        }
    }

    public BatchSnapshot editFilename(String filename) {
        synchronized (lock) {
            if (state instanceof BatchState.Displaying displaying) {
                state = new BatchState.Displaying(displaying.index(), displaying.document().withFilename(filename));
            } else if (state instanceof BatchState.Calibrating calibrating) {
                state = new BatchState.Calibrating(calibrating.index(), calibrating.document().withFilename(filename));
            } else {
                throw new BatchTransitionException("No document is displayed");
            }
            return snapshotLocked();
        }
    }

    /**
     * Commits the displayed document under {@code filename}, or under the
     * current filename field when {@code filename} is null. During calibration
     * this only ends calibration.
     */
    public CommitResult commit(String filename, OverwriteConfirmation confirmation) {
        synchronized (lock) {
            if (state instanceof BatchState.Calibrating calibrating) {
                state = new BatchState.Displaying(calibrating.index(), calibrating.document());
                message = "Calibration ended without committing.";
                return new CommitResult(CommitOutcome.CALIBRATION_EXITED, snapshotLocked());
            }
            if (!(state instanceof BatchState.Displaying displaying)) {
                throw new BatchTransitionException("No document is displayed");
            }

            CurrentDocument document = displaying.document();
            if (filename != null) {
                document = document.withFilename(filename);
                state = new BatchState.Displaying(displaying.index(), document);
            }
            String identifier = document.filename() == null ? "" : document.filename().trim();
            String problem = validateIdentifier(identifier);
            if (problem != null) {
                message = problem;
                return new CommitResult(CommitOutcome.REJECTED, snapshotLocked());
            }

            Path source = document.path();
            Path target = outputDir.resolve(identifier + extensionOf(source));
            if (Files.exists(target) && !confirmation.confirmOverwrite(target)) {
                message = target.getFileName() + " already exists. Confirm to overwrite it.";
                return new CommitResult(CommitOutcome.OVERWRITE_NOT_CONFIRMED, snapshotLocked());
            }

            try {
                closeOpenDocument();
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                logWriter.append(identifier);
            } catch (IOException e) {
                log.error("Failed to save {} as {}", source.getFileName(), target, e);
                message = "Failed to save " + target.getFileName() + ": " + e.getMessage();
                return new CommitResult(CommitOutcome.FAILED, snapshotLocked());
            }

            log.info("Committed {} as {}", source.getFileName(), target.getFileName());
            message = "Saved " + target.getFileName() + ".";
            displayFrom(displaying.index() + 1);
            return new CommitResult(CommitOutcome.COMMITTED, snapshotLocked());
        }
    }

    /**
     * Passes over the displayed document without producing output.
     */
    public BatchSnapshot skip() {
        synchronized (lock) {
            CurrentDocument document = currentDocument();
            if (document == null) {
                throw new BatchTransitionException("No document is displayed");
            }
            int index = currentIndex();
            skipped.add(new SkippedDocument(document.fileName(), "Skipped by user"));
            log.info("Skipped {} on request", document.fileName());
            message = "Skipped " + document.fileName() + ".";
            displayFrom(index + 1);
            return snapshotLocked();
        }
    }

    public BatchSnapshot toggleCalibration() {
        synchronized (lock) {
            if (state instanceof BatchState.Displaying displaying) {
                state = new BatchState.Calibrating(displaying.index(), displaying.document());
                message = "Drag over the preview to draw the new extraction region.";
            } else if (state instanceof BatchState.Calibrating calibrating) {
                state = new BatchState.Displaying(calibrating.index(), calibrating.document());
                message = null;
            } else {
                throw new BatchTransitionException("Calibration is only available while a document is displayed");
            }
            return snapshotLocked();
        }
    }

    /**
     * Completes a drag in preview space: the rectangle it spans becomes the
     * active extraction rectangle, the displayed document is read again with
     * it and the rectangle is written to the settings file.
     */
    public BatchSnapshot calibrate(Coordinate dragStart, Coordinate dragEnd) {
        synchronized (lock) {
            if (!(state instanceof BatchState.Calibrating calibrating)) {
                throw new BatchTransitionException("Calibration mode is not active");
            }
            CurrentDocument document = calibrating.document();
            ExtractionRect replacement = document.transform().toDocumentRect(dragStart, dragEnd)
                    .orElseThrow(() -> new IllegalArgumentException("The selected region is empty; drag to draw a rectangle"));

            rect = replacement;
            rectVersion++;
            rectSaved = false;
            log.info("Extraction rectangle recalibrated to {} (version {})", rect, rectVersion);

            CurrentDocument reread;
            try {
                ensureOpen(document.path());
                reread = extractInto(document);
            } catch (IOException | RuntimeException e) {
                persistRect();
                recordSkip(document.path(), e);
                displayFrom(calibrating.index() + 1);
                return snapshotLocked();
            }
            state = new BatchState.Displaying(calibrating.index(), reread);
            persistRect();
            return snapshotLocked();
        }
    }

    /**
     * Writes the active rectangle to the settings file again, e.g. after an
     * earlier write failed.
     */
    public BatchSnapshot saveCalibration() {
        synchronized (lock) {
            persistRect();
            return snapshotLocked();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closeOpenDocument();
        }
    }

    private void displayFrom(int index) {
        closeOpenDocument();
        preview = null;
        int next = index;
        while (next < queue.size()) {
            Path path = queue.get(next);
            try {
                CurrentDocument document = load(path);
                state = new BatchState.Displaying(next, document);
                log.info("Displaying {} ({}/{})", document.fileName(), next + 1, queue.size());
                return;
            } catch (DocumentProcessingException e) {
                recordSkip(path, e);
                closeOpenDocument();
                preview = null;
                next++;
            }
        }
        state = new BatchState.Done(queue.size());
        message = appendMessage(message, "All documents have been processed.");
        log.info("Batch finished: {} documents, {} skipped", queue.size(), skipped.size());
    }

    private CurrentDocument load(Path path) {
        try {
            openDocument = documentSource.open(path);
            PageSize pageSize = openDocument.firstPageSize();
            PreviewTransform transform = PreviewTransform.fit(pageSize, previewWidth, previewHeight, geometry);
            preview = openDocument.renderFirstPage(transform.scaleFactor());
            CurrentDocument document = new CurrentDocument(path, pageSize, transform, null, "", null);
            return extractInto(document);
        } catch (DocumentProcessingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DocumentProcessingException("Failed to process " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private CurrentDocument extractInto(CurrentDocument document) throws IOException {
        try {
            ExtractionResult result = extractor.extract(openDocument, rect, digitFilter);
            return document.withExtraction(result);
        } catch (RecognitionUnavailableException e) {
            log.warn("Recognition unavailable for {}: {}", document.fileName(), e.getMessage());
            message = "Text recognition failed: " + e.getMessage() + ". Enter the file name manually or skip the document.";
            return document.withRecognitionError(e.getMessage());
        }
    }

    private void refit(int index, CurrentDocument document, boolean calibrating) {
        PreviewTransform transform = PreviewTransform.fit(document.pageSize(), previewWidth, previewHeight, geometry);
        try {
            ensureOpen(document.path());
            preview = openDocument.renderFirstPage(transform.scaleFactor());
        } catch (IOException | RuntimeException e) {
            recordSkip(document.path(), e);
            displayFrom(index + 1);
            return;
        }
        CurrentDocument refitted = document.withTransform(transform);
        state = calibrating
                ? new BatchState.Calibrating(index, refitted)
                : new BatchState.Displaying(index, refitted);
    }

    private void persistRect() {
        try {
            settingsStore.saveRect(rect);
            rectSaved = true;
            message = "Saved the new extraction region to " + settingsStore.location().getFileName() + ".";
        } catch (SettingsPersistenceException e) {
            rectSaved = false;
            log.warn("Could not persist extraction rectangle {}", rect, e);
            message = "Could not save the extraction region: " + e.getMessage()
                    + ". It stays active for this run; retry saving.";
        }
    }

    private void recordSkip(Path path, Exception cause) {
        String fileName = path.getFileName().toString();
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.warn("Skipping {}: {}", fileName, reason, cause);
        skipped.add(new SkippedDocument(fileName, reason));
        message = "Error while processing " + fileName + ": " + reason + ". The document was skipped.";
    }

    private void ensureOpen(Path path) throws IOException {
        if (openDocument == null) {
            openDocument = documentSource.open(path);
        }
    }

    private void closeOpenDocument() {
        if (openDocument == null) {
            return;
        }
        try {
            openDocument.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", openDocument.fileName(), e.getMessage());
        } finally {
            openDocument = null;
        }
    }

    private String validateIdentifier(String identifier) {
        if (identifier.isEmpty() || identifier.startsWith(extractor.invalidMarker())) {
            return "Enter a valid file name.";
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isISOControl(c) || FORBIDDEN_FILENAME_CHARS.indexOf(c) >= 0) {
                return "The file name must not contain " + FORBIDDEN_FILENAME_CHARS + " or control characters.";
            }
        }
        return null;
    }

    private CurrentDocument currentDocument() {
        if (state instanceof BatchState.Displaying displaying) {
            return displaying.document();
        }
        if (state instanceof BatchState.Calibrating calibrating) {
            return calibrating.document();
        }
        return null;
    }

    private int currentIndex() {
        if (state instanceof BatchState.Displaying displaying) {
            return displaying.index();
        }
        if (state instanceof BatchState.Calibrating calibrating) {
            return calibrating.index();
        }
        if (state instanceof BatchState.Done done) {
            return done.total();
        }
        return 0;
    }

    private BatchSnapshot snapshotLocked() {
        CurrentDocument document = currentDocument();
        int index = currentIndex();
        ExtractionResult extraction = document != null ? document.extraction() : null;
        PreviewTransform transform = document != null ? document.transform() : null;
        BatchSnapshot.PreviewRegion previewRegion = null;
        if (transform != null) {
            Coordinate[] corners = transform.toPreviewRect(rect);
            previewRegion = new BatchSnapshot.PreviewRegion(corners[0].x(), corners[0].y(), corners[1].x(), corners[1].y());
        }
        return new BatchSnapshot(
                state.phase(),
                index,
                queue.size(),
                document != null ? document.fileName() : null,
                statusText(document, index),
                extraction != null ? extraction.rawText() : null,
                extraction != null ? extraction.candidate() : null,
                extraction != null && extraction.valid(),
                document != null ? document.filename() : null,
                document != null ? document.recognitionError() : null,
                rect,
                rectVersion,
                rectSaved,
                previewRegion,
                transform != null ? transform.scaleFactor() : 0d,
                transform != null ? transform.offsetX() : 0d,
                transform != null ? transform.offsetY() : 0d,
                transform != null ? transform.imageWidth() : 0,
                transform != null ? transform.imageHeight() : 0,
                message,
                List.copyOf(skipped));
    }

    private String statusText(CurrentDocument document, int index) {
        return switch (state.phase()) {
            case IDLE -> "Waiting for the preview area.";
            case DISPLAYING -> String.format(Locale.ROOT, "processing: %s (%d/%d)", document.fileName(), index + 1, queue.size());
            case CALIBRATING -> "Select a region: drag over the preview to draw a new rectangle.";
            case DONE -> String.format(Locale.ROOT, "All %d documents processed.", queue.size());
        };
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static String appendMessage(String current, String addition) {
        if (current == null || current.isBlank()) {
            return addition;
        }
        return current + " " + addition;
    }
}
