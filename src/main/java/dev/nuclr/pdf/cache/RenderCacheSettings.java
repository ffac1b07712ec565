package dev.nuclr.pdf.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Construction-time configuration of a {@link RenderCacheManager}.
 * Out-of-range values are clamped; see {@link RenderCacheProperties} for
 * loading them from a properties file.
 *
 * @param budgetBytes         hard byte budget for all cached pages
 * @param lowWaterFraction    occupancy {@code optimizeMemory} trims down to, as a fraction of the budget
 * @param renderTimeout       renders taking longer fail for every coalesced caller
 * @param defaultQuality      quality for documents without an override
 * @param cacheDirectory      private directory for descriptors and payloads
 * @param entryTtl            entries older than this are purged
 * @param renderThreads       engine worker threads; up to as many again are added while renders
 *                            that outlived their timeout keep running
 * @param preloadThreads      preload worker threads
 * @param maxPreloadPages     largest page range a single preload accepts
 * @param maintenanceInterval period of the purge and flush task; zero disables it
 */
public record RenderCacheSettings(
        long budgetBytes,
        double lowWaterFraction,
        Duration renderTimeout,
        RenderQuality defaultQuality,
        Path cacheDirectory,
        Duration entryTtl,
        int renderThreads,
        int preloadThreads,
        int maxPreloadPages,
        Duration maintenanceInterval) {

    public static final long     DEFAULT_BUDGET_BYTES      = 256L * 1024 * 1024;
    public static final double   DEFAULT_LOW_WATER         = 0.75;
    public static final double   MIN_LOW_WATER             = 0.1;
    public static final double   MAX_LOW_WATER             = 1.0;
    public static final Duration DEFAULT_RENDER_TIMEOUT    = Duration.ofSeconds(30);
    public static final Duration DEFAULT_ENTRY_TTL         = Duration.ofDays(30);
    public static final int      DEFAULT_RENDER_THREADS    = 4;
    public static final int      DEFAULT_PRELOAD_THREADS   = 2;
    public static final int      MAX_THREADS               = 256;
    public static final int      DEFAULT_MAX_PRELOAD_PAGES = 50;
    public static final Duration DEFAULT_MAINTENANCE       = Duration.ofHours(1);

    public RenderCacheSettings {
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        if (budgetBytes <= 0) {
            throw new IllegalArgumentException("budgetBytes must be positive, was " + budgetBytes);
        }
        if (Double.isNaN(lowWaterFraction)) {
            lowWaterFraction = DEFAULT_LOW_WATER;
        }
        lowWaterFraction = Math.min(Math.max(lowWaterFraction, MIN_LOW_WATER), MAX_LOW_WATER);
        if (renderTimeout == null || renderTimeout.isNegative() || renderTimeout.isZero()) {
            renderTimeout = DEFAULT_RENDER_TIMEOUT;
        }
        if (defaultQuality == null) {
            defaultQuality = RenderQuality.STANDARD;
        }
        if (entryTtl == null || entryTtl.isNegative() || entryTtl.isZero()) {
            entryTtl = DEFAULT_ENTRY_TTL;
        }
        renderThreads = Math.min(Math.max(1, renderThreads), MAX_THREADS);
        preloadThreads = Math.min(Math.max(1, preloadThreads), MAX_THREADS);
        maxPreloadPages = Math.max(1, maxPreloadPages);
        if (maintenanceInterval == null || maintenanceInterval.isNegative()) {
            maintenanceInterval = Duration.ZERO;
        }
    }

    public static RenderCacheSettings defaults(Path cacheDirectory) {
        return new RenderCacheSettings(DEFAULT_BUDGET_BYTES, DEFAULT_LOW_WATER, DEFAULT_RENDER_TIMEOUT,
                RenderQuality.STANDARD, cacheDirectory, DEFAULT_ENTRY_TTL, DEFAULT_RENDER_THREADS,
                DEFAULT_PRELOAD_THREADS, DEFAULT_MAX_PRELOAD_PAGES, DEFAULT_MAINTENANCE);
    }

    /** Occupancy {@code optimizeMemory} trims down to. */
    public long lowWaterMarkBytes() {
        return (long) (budgetBytes * lowWaterFraction);
    }

    // --- Copy-with helpers ---

    public RenderCacheSettings withBudgetBytes(long value) {
        return new RenderCacheSettings(value, lowWaterFraction, renderTimeout, defaultQuality, cacheDirectory,
                entryTtl, renderThreads, preloadThreads, maxPreloadPages, maintenanceInterval);
    }

    public RenderCacheSettings withLowWaterFraction(double value) {
        return new RenderCacheSettings(budgetBytes, value, renderTimeout, defaultQuality, cacheDirectory,
                entryTtl, renderThreads, preloadThreads, maxPreloadPages, maintenanceInterval);
    }

    public RenderCacheSettings withRenderTimeout(Duration value) {
        return new RenderCacheSettings(budgetBytes, lowWaterFraction, value, defaultQuality, cacheDirectory,
                entryTtl, renderThreads, preloadThreads, maxPreloadPages, maintenanceInterval);
    }

    public RenderCacheSettings withDefaultQuality(RenderQuality value) {
        return new RenderCacheSettings(budgetBytes, lowWaterFraction, renderTimeout, value, cacheDirectory,
                entryTtl, renderThreads, preloadThreads, maxPreloadPages, maintenanceInterval);
    }

    public RenderCacheSettings withEntryTtl(Duration value) {
        return new RenderCacheSettings(budgetBytes, lowWaterFraction, renderTimeout, defaultQuality, cacheDirectory,
                value, renderThreads, preloadThreads, maxPreloadPages, maintenanceInterval);
    }

    public RenderCacheSettings withThreads(int render, int preload) {
        return new RenderCacheSettings(budgetBytes, lowWaterFraction, renderTimeout, defaultQuality, cacheDirectory,
                entryTtl, render, preload, maxPreloadPages, maintenanceInterval);
    }

    public RenderCacheSettings withMaxPreloadPages(int value) {
        return new RenderCacheSettings(budgetBytes, lowWaterFraction, renderTimeout, defaultQuality, cacheDirectory,
                entryTtl, renderThreads, preloadThreads, value, maintenanceInterval);
    }

    public RenderCacheSettings withMaintenanceInterval(Duration value) {
        return new RenderCacheSettings(budgetBytes, lowWaterFraction, renderTimeout, defaultQuality, cacheDirectory,
                entryTtl, renderThreads, preloadThreads, maxPreloadPages, value);
    }
}
