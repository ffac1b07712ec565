package dev.nuclr.pdf.cache;

import java.util.Locale;

/**
 * What {@link RenderCacheManager#invalidate(String, InvalidationScope)} removes.
 */
public enum InvalidationScope {

    /** Every rendered page of the document. */
    PAGE,

    /** Rendered pages plus document-level state such as the render quality override. */
    DOCUMENT,

    /** Every document; statistics counters are reset as well. */
    ALL;

    /** Parse the host's {@code cacheType} value: page, document or all. */
    public static InvalidationScope fromHostValue(String cacheType) {
        if (cacheType == null || cacheType.isBlank()) {
            return ALL;
        }
        try {
            return valueOf(cacheType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyException("Unknown cache type: " + cacheType);
        }
    }
}
