package com.example.pdfrenamer.service.document;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.PageSize;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

@Component
public class PdfBoxDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentSource.class);
    private static final float POINTS_PER_INCH = 72f;

    @Override
    public PagedDocument open(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        PDDocument document = Loader.loadPDF(path.toFile());
        if (document.getNumberOfPages() == 0) {
            document.close();
            throw new IOException("Document " + path.getFileName() + " has no pages");
        }
        log.debug("Opened {} ({} pages)", path.getFileName(), document.getNumberOfPages());
        return new PdfBoxDocument(path, document);
    }

    static final class PdfBoxDocument implements PagedDocument {

        private static final String REGION_NAME = "identifier";

        private final Path path;
        private final PDDocument document;
        private final PDFRenderer renderer;

        PdfBoxDocument(Path path, PDDocument document) {
            this.path = path;
            this.document = document;
            this.renderer = new PDFRenderer(document);
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public PageSize firstPageSize() {
            PDPage page = document.getPage(0);
            PDRectangle cropBox = page.getCropBox();
            int rotation = page.getRotation();
            if (rotation == 90 || rotation == 270) {
                return new PageSize(cropBox.getHeight(), cropBox.getWidth());
            }
            return new PageSize(cropBox.getWidth(), cropBox.getHeight());
        }

        @Override
        public BufferedImage renderFirstPage(double scale) throws IOException {
            return renderer.renderImage(0, (float) scale, ImageType.RGB);
        }

        /**
         * Renders only {@code region}, clipped to the page, onto a white canvas
         * of the region's pixel size.
         */
        @Override
        public BufferedImage renderFirstPageRegion(ExtractionRect region, int dpi) throws IOException {
            float scale = dpi / POINTS_PER_INCH;
            PageSize size = firstPageSize();
            int pageWidth = Math.max(1, (int) Math.floor(size.width() * scale));
            int pageHeight = Math.max(1, (int) Math.floor(size.height() * scale));
            int x = clamp((int) Math.floor(region.x0() * scale), 0, pageWidth - 1);
            int y = clamp((int) Math.floor(region.y0() * scale), 0, pageHeight - 1);
            int width = clamp((int) Math.ceil(region.width() * scale), 1, pageWidth - x);
            int height = clamp((int) Math.ceil(region.height() * scale), 1, pageHeight - y);

            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = image.createGraphics();
            try {
                graphics.setColor(Color.WHITE);
                graphics.fillRect(0, 0, width, height);
                graphics.translate(-x, -y);
                renderer.renderPageToGraphics(0, graphics, scale);
            } finally {
                graphics.dispose();
            }
            return image;
        }

        @Override
        public String firstPageTextWithin(ExtractionRect region) throws IOException {
            PDFTextStripperByArea stripper = new PDFTextStripperByArea();
            stripper.setSortByPosition(true);
            stripper.addRegion(REGION_NAME, new Rectangle2D.Double(region.x0(), region.y0(), region.width(), region.height()));
            stripper.extractRegions(document.getPage(0));
            String text = stripper.getTextForRegion(REGION_NAME);
            return text != null ? text.trim() : "";
        }

        @Override
        public void close() throws IOException {
            document.close();
        }

        private static int clamp(int value, int min, int max) {
            return Math.max(min, Math.min(max, value));
        }
    }
}
