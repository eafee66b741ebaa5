package com.example.pdfrenamer.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces recognized text to the digits it contains. Every run of ASCII digits
 * is kept in reading order and everything else, separators included, is
 * dropped.
 */
public final class IdentifierNormalizer {

    private static final Pattern DIGIT_RUN = Pattern.compile("[0-9]+");

    private IdentifierNormalizer() {
    }

    public static String digitsOnly(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }
        StringBuilder digits = new StringBuilder();
        Matcher matcher = DIGIT_RUN.matcher(rawText);
        while (matcher.find()) {
            digits.append(matcher.group());
        }
        return digits.toString();
    }
}
