package com.example.pdfrenamer.util;

import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionBinarizerTest {

    @Test
    void mapsPixelsBelowThresholdToBlackAndOthersToWhite() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(new Color(150, 150, 150));
            g.fillRect(0, 0, 1, 1);
            g.setColor(new Color(230, 230, 230));
            g.fillRect(1, 0, 1, 1);
        } finally {
            g.dispose();
        }

        BufferedImage binary = RegionBinarizer.binarize(image, 200);

        assertThat(binary.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0x000000);
        assertThat(binary.getRGB(1, 0) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void rejectsOutOfRangeThreshold() {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);

        assertThatThrownBy(() -> RegionBinarizer.binarize(image, 300))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
