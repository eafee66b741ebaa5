package com.example.pdfrenamer.util;

import com.example.pdfrenamer.model.Coordinate;
import com.example.pdfrenamer.model.ExtractionRect;
import com.example.pdfrenamer.model.PageSize;

import java.util.Optional;

/**
 * Maps between preview space (pixels of the scaled page image centred in the
 * preview area) and document space (page units). The page is fitted into the
 * preview area on both axes, shrunk by a margin factor and centred.
 */
public record PreviewTransform(PageSize pageSize, double scaleFactor, double offsetX, double offsetY) {

    public PreviewTransform {
        if (pageSize == null) {
            throw new IllegalArgumentException("Page size is required");
        }
        if (!(scaleFactor > 0) || !Double.isFinite(scaleFactor)) {
            throw new IllegalArgumentException("Scale factor must be positive");
        }
    }

    /**
     * @param page           page dimensions in document space
     * @param previewWidth   reported width of the preview area in pixels
     * @param previewHeight  reported height of the preview area in pixels
     * @param geometry       margin and fallback size used for the fit
     */
    public static PreviewTransform fit(PageSize page, double previewWidth, double previewHeight, PreviewGeometry geometry) {
        double width = previewWidth;
        double height = previewHeight;
        if (width < geometry.minimumSize() || height < geometry.minimumSize()) {
            width = geometry.fallbackWidth();
            height = geometry.fallbackHeight();
        }
        double scale = Math.min(width / page.width(), height / page.height()) * geometry.margin();
        int imageWidth = scaledLength(page.width(), scale);
        int imageHeight = scaledLength(page.height(), scale);
        double offsetX = (width - imageWidth) / 2d;
        double offsetY = (height - imageHeight) / 2d;
        return new PreviewTransform(page, scale, offsetX, offsetY);
    }

    public Coordinate toDocumentSpace(Coordinate previewPoint) {
        return new Coordinate(
                (previewPoint.x() - offsetX) / scaleFactor,
                (previewPoint.y() - offsetY) / scaleFactor);
    }

    public Coordinate toPreviewSpace(Coordinate documentPoint) {
        return new Coordinate(
                documentPoint.x() * scaleFactor + offsetX,
                documentPoint.y() * scaleFactor + offsetY);
    }

    /**
     * Converts the two endpoints of a drag into a normalized rectangle clamped
     * to the page. Empty when the clamped rectangle has no area, e.g. a click
     * without movement or a drag entirely outside the page.
     */
    public Optional<ExtractionRect> toDocumentRect(Coordinate dragStart, Coordinate dragEnd) {
        Coordinate topLeft = toDocumentSpace(new Coordinate(
                Math.min(dragStart.x(), dragEnd.x()),
                Math.min(dragStart.y(), dragEnd.y())));
        Coordinate bottomRight = toDocumentSpace(new Coordinate(
                Math.max(dragStart.x(), dragEnd.x()),
                Math.max(dragStart.y(), dragEnd.y())));

        double x0 = clamp(topLeft.x(), 0, pageSize.width());
        double y0 = clamp(topLeft.y(), 0, pageSize.height());
        double x1 = clamp(bottomRight.x(), 0, pageSize.width());
        double y1 = clamp(bottomRight.y(), 0, pageSize.height());
        if (!(x0 < x1) || !(y0 < y1)) {
            return Optional.empty();
        }
        return Optional.of(new ExtractionRect(x0, y0, x1, y1));
    }

    public Coordinate[] toPreviewRect(ExtractionRect rect) {
        return new Coordinate[]{
                toPreviewSpace(new Coordinate(rect.x0(), rect.y0())),
                toPreviewSpace(new Coordinate(rect.x1(), rect.y1()))
        };
    }

    public int imageWidth() {
        return scaledLength(pageSize.width(), scaleFactor);
    }

    public int imageHeight() {
        return scaledLength(pageSize.height(), scaleFactor);
    }

    // Matches the pixel size PDFBox produces for a page rendered at this scale.
    private static int scaledLength(double length, double scale) {
        return (int) Math.max(Math.floor(length * scale), 1);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public record PreviewGeometry(double margin, int minimumSize, int fallbackWidth, int fallbackHeight) {

        public static final PreviewGeometry DEFAULT = new PreviewGeometry(0.95, 50, 800, 1000);

        public PreviewGeometry {
            if (!(margin > 0) || margin > 1) {
                throw new IllegalArgumentException("Preview margin must be in (0, 1]");
            }
            if (fallbackWidth <= 0 || fallbackHeight <= 0) {
                throw new IllegalArgumentException("Fallback preview size must be positive");
            }
        }
    }
}
