package dev.nuclr.pdf.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Least-recently-accessed first. Among entries last accessed at the same
 * instant the larger one goes first, so fewer evictions free the same space;
 * remaining ties go to the entry touched earliest.
 */
public final class LruEvictionPolicy implements EvictionPolicy {

    static final Comparator<CacheEntry> EVICTION_ORDER =
            Comparator.comparing(CacheEntry::lastAccessedAt)
                    .thenComparing(CacheEntry::byteSize, Comparator.reverseOrder())
                    .thenComparingLong(CacheEntry::accessSequence);

    @Override
    public List<CacheEntry> selectVictims(Collection<CacheEntry> live, long bytesToFree) {
        if (bytesToFree <= 0 || live.isEmpty()) {
            return List.of();
        }
        List<CacheEntry> candidates = new ArrayList<>(live.size());
        for (CacheEntry entry : live) {
            if (!entry.isPinned()) {
                candidates.add(entry);
            }
        }
        candidates.sort(EVICTION_ORDER);

        List<CacheEntry> victims = new ArrayList<>();
        long freed = 0;
        for (CacheEntry entry : candidates) {
            if (freed >= bytesToFree) {
                break;
            }
            victims.add(entry);
            freed += entry.byteSize();
        }
        return victims;
    }
}
