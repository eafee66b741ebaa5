package com.example.pdfrenamer.config;

import com.example.pdfrenamer.service.extraction.RegionExtractor;
import com.example.pdfrenamer.service.recognition.TesseractTextRecognizer;
import com.example.pdfrenamer.service.recognition.TextLayerRecognizer;
import com.example.pdfrenamer.service.recognition.TextRecognizer;
import com.example.pdfrenamer.service.recognition.UnavailableTextRecognizer;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selects the recognition backend. A missing Tesseract installation does not
 * stop the application: extraction then reports the backend as unavailable for
 * every document and the user types identifiers by hand.
 */
@Configuration
public class RecognitionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RecognitionConfiguration.class);

    @Bean
    public TextRecognizer textRecognizer(RenamerProperties properties) {
        if (properties.getRecognitionEngine() == RenamerProperties.RecognitionEngine.TEXT_LAYER) {
            log.info("Reading identifiers from the embedded PDF text layer");
            return new TextLayerRecognizer();
        }

        String language = properties.getLanguage();
        String resolvedDataPath = resolveDataPath(properties.getTessdataPath(), language);
        if (resolvedDataPath == null) {
            String message = String.format(Locale.ROOT,
                    "Unable to locate Tesseract language data for '%s'. " +
                            "Provide it via the renamer.tessdata-path property or the TESSDATA_PREFIX environment variable.",
                    language);
            log.error(message);
            return new UnavailableTextRecognizer(message);
        }

        log.info("Configuring Tesseract data path: {}", resolvedDataPath);
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(resolvedDataPath);
        tesseract.setLanguage(language);
        tesseract.setOcrEngineMode(ITessAPI.TessOcrEngineMode.OEM_LSTM_ONLY);
        tesseract.setPageSegMode(properties.getPageSegMode());

        String debugDir = properties.getDebugImageDir();
        Path debugImageDir = debugDir == null || debugDir.isBlank() ? null : Paths.get(debugDir);
        return new TesseractTextRecognizer(tesseract, language, properties.getOcrDpi(),
                properties.getBinarizeThreshold(), debugImageDir);
    }

    @Bean
    public RegionExtractor regionExtractor(TextRecognizer textRecognizer, RenamerProperties properties) {
        return new RegionExtractor(textRecognizer, properties.getInvalidPrefix());
    }

    static String resolveDataPath(String configuredPath, String language) {
        List<String> candidates = new ArrayList<>();
        if (configuredPath != null && !configuredPath.isBlank()) {
            candidates.add(configuredPath);
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }

        candidates.add("/usr/share/tesseract-ocr/5/tessdata");
        candidates.add("/usr/share/tesseract-ocr/4.00/tessdata");
        candidates.add("/usr/local/share/tessdata");
        candidates.add("C:/Program Files/Tesseract-OCR/tessdata");

        for (String candidate : candidates) {
            Path validPath = validateCandidate(candidate, language);
            if (validPath != null) {
                return validPath.toString();
            }
        }
        return null;
    }

    private static Path validateCandidate(String candidate, String language) {
        Path basePath = Paths.get(candidate).normalize();
        if (!Files.isDirectory(basePath)) {
            return null;
        }

        Path directLanguageFile = basePath.resolve(language + ".traineddata");
        if (Files.isRegularFile(directLanguageFile)) {
            return basePath;
        }

        Path tessdataDirectory = basePath.resolve("tessdata");
        if (Files.isDirectory(tessdataDirectory)) {
            Path nestedLanguageFile = tessdataDirectory.resolve(language + ".traineddata");
            if (Files.isRegularFile(nestedLanguageFile)) {
                return tessdataDirectory;
            }
        }

        log.debug("Tesseract data path candidate '{}' does not contain {}.traineddata", candidate, language);
        return null;
    }
}
