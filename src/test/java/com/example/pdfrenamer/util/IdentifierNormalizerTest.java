package com.example.pdfrenamer.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierNormalizerTest {

    @Test
    void concatenatesDigitRunsAndDropsEverythingElse() {
        assertThat(IdentifierNormalizer.digitsOnly("No. 12-3456  AB")).isEqualTo("123456");
    }

    @Test
    void dropsSeparatorsOfFormattedNumbers() {
        assertThat(IdentifierNormalizer.digitsOnly("1234-5678-901-2\n")).isEqualTo("123456789012");
    }

    @Test
    void keepsReadingOrderAcrossLines() {
        assertThat(IdentifierNormalizer.digitsOnly("ID 007\nREF 42")).isEqualTo("00742");
    }

    @Test
    void returnsEmptyWhenNoDigits() {
        assertThat(IdentifierNormalizer.digitsOnly("INVOICE")).isEmpty();
        assertThat(IdentifierNormalizer.digitsOnly("   ")).isEmpty();
        assertThat(IdentifierNormalizer.digitsOnly(null)).isEmpty();
    }
}
