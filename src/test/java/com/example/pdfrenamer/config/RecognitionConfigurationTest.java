package com.example.pdfrenamer.config;

import com.example.pdfrenamer.service.recognition.TesseractTextRecognizer;
import com.example.pdfrenamer.service.recognition.TextLayerRecognizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RecognitionConfigurationTest {

    @TempDir
    Path dir;

    @Test
    void acceptsDirectoryHoldingLanguageFile() throws Exception {
        Files.createFile(dir.resolve("eng.traineddata"));

        assertThat(RecognitionConfiguration.resolveDataPath(dir.toString(), "eng")).isEqualTo(dir.toString());
    }

    @Test
    void descendsIntoNestedTessdataDirectory() throws Exception {
        Path tessdata = Files.createDirectories(dir.resolve("tessdata"));
        Files.createFile(tessdata.resolve("deu.traineddata"));

        assertThat(RecognitionConfiguration.resolveDataPath(dir.toString(), "deu")).isEqualTo(tessdata.toString());
    }

    @Test
    void textLayerEngineSkipsTesseract() {
        RenamerProperties properties = new RenamerProperties();
        properties.setRecognitionEngine(RenamerProperties.RecognitionEngine.TEXT_LAYER);

        assertThat(new RecognitionConfiguration().textRecognizer(properties)).isInstanceOf(TextLayerRecognizer.class);
    }

    @Test
    void configuredDataPathBuildsTesseractRecognizer() throws Exception {
        Files.createFile(dir.resolve("eng.traineddata"));
        RenamerProperties properties = new RenamerProperties();
        properties.setTessdataPath(dir.toString());

        assertThat(new RecognitionConfiguration().textRecognizer(properties)).isInstanceOf(TesseractTextRecognizer.class);
    }
}
