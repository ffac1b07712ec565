package dev.nuclr.pdf.cache;

/**
 * Cache occupancy of a single document.
 */
public record DocumentCacheStats(
        String documentId,
        int entryCount,
        int residentEntries,
        long totalBytes,
        int pinnedEntries,
        RenderQuality renderQuality) {
}
