package dev.nuclr.pdf.cache;

import java.util.Collection;
import java.util.List;

/**
 * Chooses which entries to discard when the cache must free space.
 * Called with the manager lock held; implementations must not block.
 */
public interface EvictionPolicy {

    /**
     * Pick victims, in eviction order, whose sizes add up to at least
     * {@code bytesToFree}. Pinned entries are never selected. Returning fewer
     * bytes than requested is allowed when nothing else is evictable.
     */
    List<CacheEntry> selectVictims(Collection<CacheEntry> live, long bytesToFree);
}
