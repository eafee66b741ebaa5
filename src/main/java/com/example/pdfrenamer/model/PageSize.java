package com.example.pdfrenamer.model;

public record PageSize(double width, double height) {

    public PageSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Page dimensions must be positive");
        }
    }
}
