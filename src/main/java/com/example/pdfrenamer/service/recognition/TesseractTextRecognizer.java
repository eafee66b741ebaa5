package com.example.pdfrenamer.service.recognition;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.service.document.PagedDocument;
import com.example.pdfrenamer.util.RegionBinarizer;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

public class TesseractTextRecognizer implements TextRecognizer {

    private static final Logger log = LoggerFactory.getLogger(TesseractTextRecognizer.class);

    private final ITesseract tesseract;
    private final String language;
    private final int dpi;
    private final int threshold;
    private final Path debugImageDir;

    public TesseractTextRecognizer(ITesseract tesseract, String language, int dpi, int threshold, Path debugImageDir) {
        this.tesseract = Objects.requireNonNull(tesseract, "tesseract");
        this.language = language;
        this.dpi = dpi;
        this.threshold = threshold;
        this.debugImageDir = debugImageDir;
    }

    @Override
    public String recognize(PagedDocument document, ExtractionRect region) throws IOException, RecognitionUnavailableException {
        BufferedImage rendered = document.renderFirstPageRegion(region, dpi);
        BufferedImage binary = RegionBinarizer.binarize(rendered, threshold);
        saveDebugImage(document, binary);

        String fileName = document.fileName();
        try {
            String raw = tesseract.doOCR(binary);
            String text = raw != null ? raw.replace('\u0000', ' ').trim() : "";
            log.debug("Tesseract read '{}' from {}", text, fileName);
            return text;
        } catch (TesseractException e) {
            log.error("Tesseract OCR failed for {}", fileName, e);
            throw new RecognitionUnavailableException("OCR failed for " + fileName + ": " + e.getMessage(), e);
        } catch (LinkageError e) {
            // UnsatisfiedLinkError on the first call, NoClassDefFoundError for TessAPI on every later one
            log.error("Tesseract native library could not be loaded", e);
            throw new RecognitionUnavailableException("Tesseract is not installed or could not be loaded", e);
        } catch (Error e) {
            if ("Invalid memory access".equalsIgnoreCase(e.getMessage())) {
                String message = String.format(Locale.ROOT,
                        "Tesseract native layer failed while processing %s. Verify that the tessdata directory contains %s.traineddata.",
                        fileName, language);
                log.error(message, e);
                throw new RecognitionUnavailableException(message, e);
            }
            throw e;
        }
    }

    private void saveDebugImage(PagedDocument document, BufferedImage image) {
        if (debugImageDir == null) {
            return;
        }
        String baseName = document.fileName();
        int dot = baseName.lastIndexOf('.');
        if (dot > 0) {
            baseName = baseName.substring(0, dot);
        }
        Path target = debugImageDir.resolve(baseName + ".png");
        try {
            Files.createDirectories(debugImageDir);
            ImageIO.write(image, "png", target.toFile());
        } catch (IOException e) {
            log.warn("Could not save OCR debug image {}: {}", target, e.getMessage());
        }
    }
}
