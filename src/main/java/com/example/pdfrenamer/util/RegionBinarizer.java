package com.example.pdfrenamer.util;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Prepares a rendered region for Tesseract: grayscale conversion followed by a
 * fixed global threshold. Pixels darker than the threshold become black, the
 * rest white.
 */
public final class RegionBinarizer {

    private RegionBinarizer() {
    }

    public static BufferedImage binarize(BufferedImage input, int threshold) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        if (threshold < 0 || threshold > 255) {
            throw new IllegalArgumentException("Threshold must be between 0 and 255");
        }
        BufferedImage grayscale = toGrayscale(input);
        int width = grayscale.getWidth();
        int height = grayscale.getHeight();
        BufferedImage binary = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_BINARY);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int gray = grayscale.getRaster().getSample(x, y, 0);
                binary.getRaster().setSample(x, y, 0, gray < threshold ? 0 : 1);
            }
        }
        return binary;
    }

    private static BufferedImage toGrayscale(BufferedImage input) {
        BufferedImage grayscale = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = grayscale.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(input, 0, 0, null);
        } finally {
            g.dispose();
        }
        return grayscale;
    }
}
