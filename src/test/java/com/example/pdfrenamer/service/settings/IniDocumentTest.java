package com.example.pdfrenamer.service.settings;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IniDocumentTest {

    @Test
    void matchesKeysIgnoringCaseButSectionsExactly() {
        IniDocument ini = IniDocument.parse("[OCR]\nWidth = 80\n[ocr]\nwidth = 5\n");

        assertThat(ini.get("OCR", "width")).contains("80");
        assertThat(ini.get("ocr", "WIDTH")).contains("5");
        assertThat(ini.get("Ocr", "width")).isEmpty();
    }

    @Test
    void ignoresCommentsAndEntriesBeforeFirstSection() {
        IniDocument ini = IniDocument.parse("x = 1\n[OCR]\n# x = 2\n  ; y = 3\nx: 4\n");

        assertThat(ini.get("OCR", "x")).contains("4");
        assertThat(ini.get("OCR", "y")).isEmpty();
    }

    @Test
    void replacingValueDropsItsContinuationLines() {
        IniDocument ini = IniDocument.parse("[Paths]\ninput_dir = first\n    second\nlog_dir = logs\n");

        assertThat(ini.get("Paths", "input_dir")).contains("first\nsecond");

        ini.set("Paths", "input_dir", "scans");

        assertThat(ini.render()).isEqualTo("[Paths]\ninput_dir = scans\nlog_dir = logs\n");
    }

    @Test
    void keepsMissingTrailingNewline() {
        IniDocument ini = IniDocument.parse("[OCR]\nx = 1");

        ini.set("OCR", "x", "2");

        assertThat(ini.render()).isEqualTo("[OCR]\nx = 2");
    }
}
