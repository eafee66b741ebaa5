package com.example.pdfrenamer.model;

/**
 * Required digit count for a candidate identifier. Zero disables the length
 * check.
 */
public record DigitFilter(int digits) {

    public static final DigitFilter DISABLED = new DigitFilter(0);

    public DigitFilter {
        if (digits < 0) {
            throw new IllegalArgumentException("Digit filter must not be negative");
        }
    }

    public boolean isEnabled() {
        return digits > 0;
    }

    public boolean accepts(String candidate) {
        if (!isEnabled()) {
            return true;
        }
        return candidate != null && candidate.length() == digits;
    }
}
