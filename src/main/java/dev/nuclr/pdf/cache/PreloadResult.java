package dev.nuclr.pdf.cache;

import java.util.List;
import java.util.Map;

/**
 * Per-page outcome of a {@link RenderCacheManager#preload} batch. Failures are
 * recorded here rather than raised.
 *
 * @param cachedPages  pages that are now in the cache
 * @param failedPages  page number to failure message
 * @param skippedPages pages not attempted because a later preload or an
 *                     invalidation superseded the batch
 */
public record PreloadResult(
        String documentId,
        List<Integer> cachedPages,
        Map<Integer, String> failedPages,
        List<Integer> skippedPages) {

    public PreloadResult {
        cachedPages = List.copyOf(cachedPages);
        failedPages = Map.copyOf(failedPages);
        skippedPages = List.copyOf(skippedPages);
    }

    public int requestedPages() {
        return cachedPages.size() + failedPages.size() + skippedPages.size();
    }

    public boolean isComplete() {
        return failedPages.isEmpty() && skippedPages.isEmpty();
    }

    public boolean isPartialSuccess() {
        return !cachedPages.isEmpty() && !isComplete();
    }
}
