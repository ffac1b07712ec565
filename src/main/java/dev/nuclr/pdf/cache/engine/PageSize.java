package dev.nuclr.pdf.cache.engine;

/**
 * Page dimensions in PDF points (1/72 inch).
 */
public record PageSize(float widthPoints, float heightPoints) {

    /** Pixel width of the page rendered at {@code scale} and {@code rotation}. */
    public int pixelWidth(float scale, int rotation) {
        float w = (rotation == 90 || rotation == 270) ? heightPoints : widthPoints;
        return Math.max(1, Math.round(w * scale));
    }

    /** Pixel height of the page rendered at {@code scale} and {@code rotation}. */
    public int pixelHeight(float scale, int rotation) {
        float h = (rotation == 90 || rotation == 270) ? widthPoints : heightPoints;
        return Math.max(1, Math.round(h * scale));
    }
}
