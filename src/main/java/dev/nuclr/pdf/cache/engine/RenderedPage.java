package dev.nuclr.pdf.cache.engine;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Pixel buffer produced by a {@link PageRenderer} together with the time it took.
 */
public record RenderedPage(BufferedImage image, long renderTimeMs) {

    public RenderedPage {
        Objects.requireNonNull(image, "image");
        if (renderTimeMs < 0) {
            renderTimeMs = 0;
        }
    }
}
