package com.example.pdfrenamer.controller;

import com.example.pdfrenamer.model.Coordinate;
import com.example.pdfrenamer.model.api.CalibrationRequest;
import com.example.pdfrenamer.model.api.CommitRequest;
import com.example.pdfrenamer.model.api.FilenameRequest;
import com.example.pdfrenamer.model.api.LayoutRequest;
import com.example.pdfrenamer.service.batch.BatchPipeline;
import com.example.pdfrenamer.service.batch.BatchSnapshot;
import com.example.pdfrenamer.service.batch.CommitResult;
import com.example.pdfrenamer.service.batch.OverwriteConfirmation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;

@RestController
@RequestMapping("/api/batch")
@Tag(name = "Batch", description = "Step through the queued documents, confirm identifiers and recalibrate the extraction region")
public class BatchController {

    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final BatchPipeline pipeline;

    public BatchController(BatchPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping
    @Operation(summary = "Current state of the batch")
    public ResponseEntity<BatchSnapshot> snapshot() {
        return ResponseEntity.ok(pipeline.snapshot());
    }

    @PostMapping(value = "/layout", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Report the preview area size",
            description = "The first call starts the batch. Later calls refit the displayed page to the new size.")
    public ResponseEntity<BatchSnapshot> layout(@Valid @RequestBody LayoutRequest request) {
        return ResponseEntity.ok(pipeline.layoutReady(request.width(), request.height()));
    }

    @GetMapping(value = "/preview", produces = MediaType.IMAGE_PNG_VALUE)
    @Operation(summary = "First page of the displayed document, rendered at the preview scale")
    public ResponseEntity<byte[]> preview() {
        BufferedImage image = pipeline.preview();
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", output);
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .body(output.toByteArray());
        } catch (IOException ex) {
            log.error("Failed to encode preview image", ex);
            throw new ResponseStatusException(INTERNAL_SERVER_ERROR, "Failed to encode preview image", ex);
        }
    }

    @PutMapping(value = "/filename", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Edit the filename field of the displayed document")
    public ResponseEntity<BatchSnapshot> editFilename(@Valid @RequestBody FilenameRequest request) {
        return ResponseEntity.ok(pipeline.editFilename(request.filename()));
    }

    @PostMapping(value = "/commit", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Copy the displayed document to the output directory under the confirmed identifier",
            description = "An existing target is only replaced when overwrite is true. During calibration this ends calibration instead.")
    public ResponseEntity<CommitResult> commit(@RequestBody CommitRequest request) {
        OverwriteConfirmation confirmation = request.overwrite() ? OverwriteConfirmation.ACCEPT : OverwriteConfirmation.DECLINE;
        return ResponseEntity.ok(pipeline.commit(request.filename(), confirmation));
    }

    @PostMapping("/skip")
    @Operation(summary = "Move on to the next document without saving the displayed one")
    public ResponseEntity<BatchSnapshot> skip() {
        return ResponseEntity.ok(pipeline.skip());
    }

    @PostMapping("/calibration/toggle")
    @Operation(summary = "Enter or leave calibration mode")
    public ResponseEntity<BatchSnapshot> toggleCalibration() {
        return ResponseEntity.ok(pipeline.toggleCalibration());
    }

    @PostMapping(value = "/calibration", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Release of a drag over the preview",
            description = "The dragged rectangle becomes the extraction region, the document is read again and the region is saved.")
    public ResponseEntity<BatchSnapshot> calibrate(@RequestBody CalibrationRequest request) {
        return ResponseEntity.ok(pipeline.calibrate(
                new Coordinate(request.startX(), request.startY()),
                new Coordinate(request.endX(), request.endY())));
    }

    @PostMapping("/calibration/save")
    @Operation(summary = "Write the active extraction region to the settings file again")
    public ResponseEntity<BatchSnapshot> saveCalibration() {
        return ResponseEntity.ok(pipeline.saveCalibration());
    }
}
