package dev.nuclr.pdf.cache;

/**
 * Outcome of {@link RenderCacheManager#optimizeMemory(String)}.
 *
 * @param documentId      document that was trimmed, or null for all documents
 * @param evictedEntries  entries removed by this pass
 * @param freedBytes      bytes released by this pass
 * @param totalBytesAfter cache occupancy when the pass finished
 * @param lowWaterMark    occupancy the pass aimed for
 */
public record OptimizeResult(
        String documentId,
        int evictedEntries,
        long freedBytes,
        long totalBytesAfter,
        long lowWaterMark) {

    public boolean reachedLowWaterMark() {
        return totalBytesAfter <= lowWaterMark;
    }
}
