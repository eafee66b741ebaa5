package com.example.pdfrenamer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "renamer")
public class RenamerProperties {

    public enum RecognitionEngine {
        TESSERACT,
        TEXT_LAYER
    }

    private String settingsFile = "config.txt";
    private String documentExtension = ".pdf";
    private double previewMargin = 0.95;
    private int previewMinimumSize = 50;
    private int previewFallbackWidth = 800;
    private int previewFallbackHeight = 1000;
    private RecognitionEngine recognitionEngine = RecognitionEngine.TESSERACT;
    private int ocrDpi = 300;
    private int binarizeThreshold = 200;
    private String tessdataPath = "";
    private String language = "eng";
    private int pageSegMode = 6;
    private String debugImageDir = "";
    private String invalidPrefix = "(invalid) ";

    public String getSettingsFile() {
        return settingsFile;
    }

    public void setSettingsFile(String settingsFile) {
        this.settingsFile = settingsFile;
    }

    public String getDocumentExtension() {
        return documentExtension;
    }

    public void setDocumentExtension(String documentExtension) {
        this.documentExtension = documentExtension;
    }

    public double getPreviewMargin() {
        return previewMargin;
    }

    public void setPreviewMargin(double previewMargin) {
        this.previewMargin = previewMargin;
    }

    public int getPreviewMinimumSize() {
        return previewMinimumSize;
    }

    public void setPreviewMinimumSize(int previewMinimumSize) {
        this.previewMinimumSize = previewMinimumSize;
    }

    public int getPreviewFallbackWidth() {
        return previewFallbackWidth;
    }

    public void setPreviewFallbackWidth(int previewFallbackWidth) {
        this.previewFallbackWidth = previewFallbackWidth;
    }

    public int getPreviewFallbackHeight() {
        return previewFallbackHeight;
    }

    public void setPreviewFallbackHeight(int previewFallbackHeight) {
        this.previewFallbackHeight = previewFallbackHeight;
    }

    public RecognitionEngine getRecognitionEngine() {
        return recognitionEngine;
    }

    public void setRecognitionEngine(RecognitionEngine recognitionEngine) {
        this.recognitionEngine = recognitionEngine;
    }

    public int getOcrDpi() {
        return ocrDpi;
    }

    public void setOcrDpi(int ocrDpi) {
        this.ocrDpi = ocrDpi;
    }

    public int getBinarizeThreshold() {
        return binarizeThreshold;
    }

    public void setBinarizeThreshold(int binarizeThreshold) {
        this.binarizeThreshold = binarizeThreshold;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public int getPageSegMode() {
        return pageSegMode;
    }

    public void setPageSegMode(int pageSegMode) {
        this.pageSegMode = pageSegMode;
    }

    public String getDebugImageDir() {
        return debugImageDir;
    }

    public void setDebugImageDir(String debugImageDir) {
        this.debugImageDir = debugImageDir;
    }

    public String getInvalidPrefix() {
        return invalidPrefix;
    }

    public void setInvalidPrefix(String invalidPrefix) {
        this.invalidPrefix = invalidPrefix;
    }
}
