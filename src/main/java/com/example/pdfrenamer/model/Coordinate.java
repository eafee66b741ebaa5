package com.example.pdfrenamer.model;

public record Coordinate(double x, double y) {
}
