package com.example.pdfrenamer.service.document;

import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.PageSize;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Open handle on a paged document. Only the first page is ever read. The handle
 * must be closed before the underlying file is copied.
 */
public interface PagedDocument extends Closeable {

    Path path();

    int pageCount();

    /**
     * @return dimensions of the first page in document-space units
     */
    PageSize firstPageSize();

    /**
     * Rasterizes the whole first page, {@code scale} pixels per document unit.
     */
    BufferedImage renderFirstPage(double scale) throws IOException;

    /**
     * Rasterizes only {@code region} of the first page at the given resolution.
     */
    BufferedImage renderFirstPageRegion(ExtractionRect region, int dpi) throws IOException;

    /**
     * Returns the embedded text of the first page that falls inside
     * {@code region}, in reading order.
     */
    String firstPageTextWithin(ExtractionRect region) throws IOException;

    default String fileName() {
        return path().getFileName().toString();
    }
}
