package com.example.pdfrenamer.controller;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.service.batch.BatchPhase;
import com.example.pdfrenamer.service.batch.BatchPipeline;
import com.example.pdfrenamer.service.batch.BatchSnapshot;
import com.example.pdfrenamer.service.batch.BatchTransitionException;
import com.example.pdfrenamer.service.batch.CommitOutcome;
import com.example.pdfrenamer.service.batch.CommitResult;
import com.example.pdfrenamer.service.batch.OverwriteConfirmation;
import com.example.pdfrenamer.model.Coordinate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BatchController.class)
class BatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchPipeline pipeline;

    @Test
    void layoutStartsBatch() throws Exception {
        when(pipeline.layoutReady(900, 1100)).thenReturn(displaying("123456"));

        mockMvc.perform(post("/api/batch/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"width\": 900, \"height\": 1100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("DISPLAYING"))
                .andExpect(jsonPath("$.statusText").value("processing: scan_0001.pdf (1/3)"))
                .andExpect(jsonPath("$.filename").value("123456"))
                .andExpect(jsonPath("$.rect.x0").value(50.0));
    }

    @Test
    void layoutRejectsNegativeSize() throws Exception {
        mockMvc.perform(post("/api/batch/layout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"width\": -1, \"height\": 1100}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/batch/layout"));

        verifyNoInteractions(pipeline);
    }

    @Test
    void commitPassesOverwriteConfirmation() throws Exception {
        when(pipeline.commit("555", OverwriteConfirmation.ACCEPT))
                .thenReturn(new CommitResult(CommitOutcome.COMMITTED, displaying("777")));

        mockMvc.perform(post("/api/batch/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\": \"555\", \"overwrite\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMMITTED"))
                .andExpect(jsonPath("$.snapshot.filename").value("777"));

        verify(pipeline).commit("555", OverwriteConfirmation.ACCEPT);
    }

    @Test
    void commitWithoutOverwriteDeclinesReplacement() throws Exception {
        when(pipeline.commit(null, OverwriteConfirmation.DECLINE))
                .thenReturn(new CommitResult(CommitOutcome.OVERWRITE_NOT_CONFIRMED, displaying("555")));

        mockMvc.perform(post("/api/batch/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("OVERWRITE_NOT_CONFIRMED"));
    }

    @Test
    void editFilenameRequiresValue() throws Exception {
        mockMvc.perform(put("/api/batch/filename")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void emptyDragIsBadRequest() throws Exception {
        when(pipeline.calibrate(new Coordinate(10, 10), new Coordinate(10, 10)))
                .thenThrow(new IllegalArgumentException("The selected region is empty; drag to draw a rectangle"));

        mockMvc.perform(post("/api/batch/calibration")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startX\": 10, \"startY\": 10, \"endX\": 10, \"endY\": 10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("The selected region is empty; drag to draw a rectangle"));
    }

    @Test
    void transitionInWrongStateIsConflict() throws Exception {
        when(pipeline.skip()).thenThrow(new BatchTransitionException("No document is displayed"));

        mockMvc.perform(post("/api/batch/skip"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"))
                .andExpect(jsonPath("$.message").value("No document is displayed"));
    }

    @Test
    void unrelatedIllegalStateIsNotReportedAsConflict() {
        when(pipeline.skip()).thenThrow(new IllegalStateException("stream closed"));

        assertThatThrownBy(() -> mockMvc.perform(post("/api/batch/skip")))
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void savingCalibrationAgainReportsSavedRect() throws Exception {
        when(pipeline.saveCalibration()).thenReturn(displaying("555"));

        mockMvc.perform(post("/api/batch/calibration/save"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rectSaved").value(true))
                .andExpect(jsonPath("$.rect.x1").value(250.0));

        verify(pipeline).saveCalibration();
    }

    @Test
    void previewIsServedAsPng() throws Exception {
        when(pipeline.preview()).thenReturn(new BufferedImage(20, 30, BufferedImage.TYPE_INT_RGB));

        mockMvc.perform(get("/api/batch/preview"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG));
    }

    @Test
    void snapshotReportsCurrentState() throws Exception {
        when(pipeline.snapshot()).thenReturn(displaying("42"));

        mockMvc.perform(get("/api/batch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.index").value(0))
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.previewRect.x1").value(240.0));
    }

    private static BatchSnapshot displaying(String filename) {
        return new BatchSnapshot(
                BatchPhase.DISPLAYING,
                0,
                3,
                "scan_0001.pdf",
                "processing: scan_0001.pdf (1/3)",
                "No. " + filename,
                filename,
                true,
                filename,
                null,
                ExtractionRect.DEFAULT,
                0,
                true,
                new BatchSnapshot.PreviewRegion(60, 60, 240, 120),
                1.2,
                0,
                0,
                714,
                1010,
                null,
                List.of());
    }
}
