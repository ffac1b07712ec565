package dev.nuclr.pdf.cache;

/**
 * Quality bucket applied to the base scale of {@link RenderCacheManager#renderPage}.
 * Levels follow the host's 1..3 range; STANDARD matches 144 DPI and HIGH
 * approaches 200 DPI for a base scale of 1.0.
 */
public enum RenderQuality {

    DRAFT(1, 1.0f),
    STANDARD(2, 2.0f),
    HIGH(3, 2.75f);

    private final int level;
    private final float scaleFactor;

    RenderQuality(int level, float scaleFactor) {
        this.level = level;
        this.scaleFactor = scaleFactor;
    }

    public int level() {
        return level;
    }

    public float scaleFactor() {
        return scaleFactor;
    }

    public float apply(float baseScale) {
        return baseScale * scaleFactor;
    }

    public static RenderQuality fromLevel(int level) {
        for (RenderQuality q : values()) {
            if (q.level == level) {
                return q;
            }
        }
        throw new InvalidKeyException("Render quality must be between 1 and 3, was " + level);
    }
}
