package dev.nuclr.pdf.cache;

/**
 * Point-in-time copy of the cache counters.
 *
 * <p>Counters are monotonic for the lifetime of a manager and are reset only by
 * {@link RenderCacheManager#invalidate(String, InvalidationScope)} with
 * {@link InvalidationScope#ALL}. {@code totalBytes} and {@code entryCount}
 * describe the live entry set.
 */
public record CacheStats(
        long hits,
        long misses,
        long totalBytes,
        int entryCount,
        long evictionCount,
        long budgetBytes,
        int pinnedEntries,
        long coalescedWaits,
        long renderCount,
        long renderFailures,
        long renderTimeouts,
        long overBudgetInserts,
        long expiredEntries,
        long totalRenderTimeMs) {

    /** Hits over lookups, 0.0 to 1.0. */
    public double hitRatio() {
        long lookups = hits + misses;
        return lookups > 0 ? (double) hits / lookups : 0.0;
    }

    public double averageRenderTimeMs() {
        return renderCount > 0 ? (double) totalRenderTimeMs / renderCount : 0.0;
    }
}
