package dev.nuclr.pdf.cache.bridge;

import dev.nuclr.pdf.cache.CacheEntry;
import dev.nuclr.pdf.cache.CacheStats;
import dev.nuclr.pdf.cache.DocumentCacheStats;
import dev.nuclr.pdf.cache.InvalidationScope;
import dev.nuclr.pdf.cache.OptimizeResult;
import dev.nuclr.pdf.cache.PageKey;
import dev.nuclr.pdf.cache.RenderCacheManager;
import dev.nuclr.pdf.cache.RenderQuality;
import dev.nuclr.pdf.cache.engine.PageRenderer;
import dev.nuclr.pdf.cache.engine.PageSize;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Host-facing adapter over {@link RenderCacheManager}.
 *
 * <p>Every call returns a future that always completes normally with a map
 * holding a boolean {@code success}. Failures carry {@code errorCode} and
 * {@code message} instead of completing the future exceptionally, so the host
 * sees one result shape. Arguments the cache rejects map to
 * {@link #INVALID_ARGUMENT}.
 *
 * <p>Work runs on the executor passed in; the caller's thread never renders.
 */
@Slf4j
public class PdfViewerBridge {

    public static final String RENDER_ERROR              = "RENDER_ERROR";
    public static final String METRICS_ERROR             = "METRICS_ERROR";
    public static final String PRELOAD_ERROR             = "PRELOAD_ERROR";
    public static final String CACHE_METRICS_ERROR       = "CACHE_METRICS_ERROR";
    public static final String PERFORMANCE_METRICS_ERROR = "PERFORMANCE_METRICS_ERROR";
    public static final String CLEAR_CACHE_ERROR         = "CLEAR_CACHE_ERROR";
    public static final String OPTIMIZE_MEMORY_ERROR     = "OPTIMIZE_MEMORY_ERROR";
    public static final String SET_RENDER_QUALITY_ERROR  = "SET_RENDER_QUALITY_ERROR";
    public static final String INVALID_ARGUMENT          = "INVALID_ARGUMENT";

    @FunctionalInterface
    private interface BridgeCall {
        Map<String, Object> run() throws Exception;
    }

    private final RenderCacheManager cache;
    private final PageRenderer engine;
    private final Executor executor;

    public PdfViewerBridge(RenderCacheManager cache, PageRenderer engine, Executor executor) {
        this.cache    = Objects.requireNonNull(cache, "cache");
        this.engine   = Objects.requireNonNull(engine, "engine");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    // -------------------------------------------------------------- rendering

    /**
     * Render a page at the document's current quality. The result describes the
     * bitmap; {@code image} holds the pixels themselves. {@code fromCache} is
     * true when the page was served without waiting for a render or a disk read.
     */
    public CompletableFuture<Map<String, Object>> renderPage(String pdfId, int pageNumber, double scale, int rotation) {
        return submit(RENDER_ERROR, () -> {
            log.debug("Bridge: render page {} of {} at scale {}", pageNumber, pdfId, scale);
            try (CacheEntry entry = cache.renderPage(pdfId, pageNumber, (float) scale, rotation)) {
                PageKey key = entry.key();
                Map<String, Object> result = ok();
                result.put("pdfId", key.documentId());
                result.put("pageNumber", key.pageNumber());
                result.put("width", entry.payload().getWidth());
                result.put("height", entry.payload().getHeight());
                result.put("scale", (double) key.scale());
                result.put("rotation", key.rotation());
                result.put("byteSize", entry.byteSize());
                result.put("renderTimeMs", entry.renderTimeMs());
                result.put("fromCache", entry.accessCount() > 1);
                result.put("image", entry.payload());
                return result;
            }
        });
    }

    /** Page dimensions in points and in pixels at the document's current quality. */
    public CompletableFuture<Map<String, Object>> getPageMetrics(String pdfId, int pageNumber) {
        return submit(METRICS_ERROR, () -> {
            PageKey key = cache.keyFor(pdfId, pageNumber, 1.0f, 0);
            PageSize size = engine.pageSize(pdfId, pageNumber);
            RenderQuality quality = cache.getRenderQuality(pdfId);
            Map<String, Object> result = ok();
            result.put("pdfId", pdfId);
            result.put("pageNumber", pageNumber);
            result.put("widthPoints", (double) size.widthPoints());
            result.put("heightPoints", (double) size.heightPoints());
            result.put("width", size.pixelWidth(key.scale(), 0));
            result.put("height", size.pixelHeight(key.scale(), 0));
            result.put("scale", (double) key.scale());
            result.put("renderQuality", quality.level());
            return result;
        });
    }

    // ---------------------------------------------------------------- preload

    /** Preload pages {@code startPage..endPage} inclusive; completes when the batch is done. */
    public CompletableFuture<Map<String, Object>> preloadPages(String pdfId, int startPage, int endPage) {
        CompletableFuture<Map<String, Object>> future;
        try {
            future = cache.preload(pdfId, startPage, endPage).thenApply(preload -> {
                Map<String, Object> result = ok();
                result.put("pdfId", pdfId);
                result.put("requested", preload.requestedPages());
                result.put("cached", preload.cachedPages().size());
                result.put("failed", preload.failedPages().size());
                result.put("skipped", preload.skippedPages().size());
                result.put("partial", preload.isPartialSuccess());
                result.put("failures", new LinkedHashMap<>(preload.failedPages()));
                return result;
            });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(failure(PRELOAD_ERROR, e));
        }
        return future.exceptionally(e -> failure(PRELOAD_ERROR, unwrap(e)));
    }

    // ---------------------------------------------------------------- metrics

    /** Occupancy of one document, or of the whole cache when {@code pdfId} is null. */
    public CompletableFuture<Map<String, Object>> getCacheMetrics(String pdfId) {
        return submit(CACHE_METRICS_ERROR, () -> {
            CacheStats stats = cache.metrics();
            Map<String, Object> result = ok();
            if (pdfId != null) {
                DocumentCacheStats doc = cache.metrics(pdfId);
                result.put("pdfId", pdfId);
                result.put("entries", doc.entryCount());
                result.put("residentEntries", doc.residentEntries());
                result.put("bytes", doc.totalBytes());
                result.put("pinnedEntries", doc.pinnedEntries());
                result.put("renderQuality", doc.renderQuality().level());
            }
            result.put("totalEntries", stats.entryCount());
            result.put("totalBytes", stats.totalBytes());
            result.put("budgetBytes", stats.budgetBytes());
            result.put("hits", stats.hits());
            result.put("misses", stats.misses());
            result.put("hitRatio", stats.hitRatio());
            result.put("evictions", stats.evictionCount());
            return result;
        });
    }

    public CompletableFuture<Map<String, Object>> getPerformanceMetrics(String pdfId) {
        return submit(PERFORMANCE_METRICS_ERROR, () -> {
            CacheStats stats = cache.metrics();
            Map<String, Object> result = ok();
            result.put("pdfId", pdfId);
            result.put("renderCount", stats.renderCount());
            result.put("averageRenderTimeMs", stats.averageRenderTimeMs());
            result.put("renderFailures", stats.renderFailures());
            result.put("renderTimeouts", stats.renderTimeouts());
            result.put("coalescedWaits", stats.coalescedWaits());
            result.put("overBudgetInserts", stats.overBudgetInserts());
            result.put("hitRatio", stats.hitRatio());
            return result;
        });
    }

    // ------------------------------------------------------------ maintenance

    /** {@code cacheType} is one of page, document or all; null means all. */
    public CompletableFuture<Map<String, Object>> clearCache(String pdfId, String cacheType) {
        return submit(CLEAR_CACHE_ERROR, () -> {
            InvalidationScope scope = InvalidationScope.fromHostValue(cacheType);
            int removed = cache.invalidate(pdfId, scope);
            Map<String, Object> result = ok();
            result.put("scope", scope.name().toLowerCase(Locale.ROOT));
            result.put("removedEntries", removed);
            return result;
        });
    }

    /** Trim one document's entries, or every document's when {@code pdfId} is null. */
    public CompletableFuture<Map<String, Object>> optimizeMemory(String pdfId) {
        return submit(OPTIMIZE_MEMORY_ERROR, () -> {
            OptimizeResult optimized = cache.optimizeMemory(pdfId);
            Map<String, Object> result = ok();
            result.put("evictedEntries", optimized.evictedEntries());
            result.put("freedBytes", optimized.freedBytes());
            result.put("totalBytes", optimized.totalBytesAfter());
            result.put("reachedLowWaterMark", optimized.reachedLowWaterMark());
            return result;
        });
    }

    /** {@code quality} is the host's level: 1 draft, 2 standard, 3 high. */
    public CompletableFuture<Map<String, Object>> setRenderQuality(String pdfId, int quality) {
        return submit(SET_RENDER_QUALITY_ERROR, () -> {
            RenderQuality renderQuality = RenderQuality.fromLevel(quality);
            cache.setRenderQuality(pdfId, renderQuality);
            Map<String, Object> result = ok();
            result.put("pdfId", pdfId);
            result.put("renderQuality", renderQuality.level());
            return result;
        });
    }

    // ---------------------------------------------------------------- helpers

    private CompletableFuture<Map<String, Object>> submit(String errorCode, BridgeCall call) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return call.run();
                } catch (Exception e) {
                    return failure(errorCode, e);
                }
            }, executor);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(failure(errorCode, e));
        }
    }

    private static Map<String, Object> failure(String errorCode, Throwable e) {
        String code = e instanceof IllegalArgumentException ? INVALID_ARGUMENT : errorCode;
        if (code.equals(INVALID_ARGUMENT)) {
            log.warn("Bridge call rejected: {}", e.getMessage());
        } else {
            log.error("Bridge call failed with {}", code, e);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("errorCode", code);
        result.put("message", String.valueOf(e.getMessage()));
        return result;
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static Map<String, Object> ok() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        return result;
    }
}
