package dev.nuclr.pdf.cache;

import dev.nuclr.pdf.cache.store.PageDescriptor;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One cached render.
 *
 * <p>An entry returned by {@link RenderCacheManager#getOrRender} is pinned for
 * the caller and cannot be evicted until the caller releases it, either with
 * {@link #release()} or by closing it in a try-with-resources block. Each
 * successful {@code getOrRender} call must be matched by exactly one release.
 *
 * <p>An entry restored from disk after a restart is <em>cold</em>: it takes part
 * in accounting but holds no pixels until it is first requested.
 */
public final class CacheEntry implements AutoCloseable {

    /** Bytes per pixel of the 32-bit bitmaps handed to the host. */
    public static final int BYTES_PER_PIXEL = 4;

    /** Orders accesses that share a millisecond timestamp. */
    private static final AtomicLong ACCESS_SEQUENCE = new AtomicLong();

    private final PageKey key;
    private final BufferedImage payload;
    private final long byteSize;
    private final Instant createdAt;
    private final long renderTimeMs;
    private final String payloadFile;

    // Written under the manager lock; volatile for cheap reads elsewhere
    private volatile Instant lastAccessedAt;
    private volatile Instant persistedAccessAt;
    private volatile long accessSequence;

    private final AtomicInteger pins = new AtomicInteger();
    private final AtomicLong accessCount = new AtomicLong();

    CacheEntry(PageKey key, BufferedImage payload, long byteSize, Instant createdAt,
               Instant lastAccessedAt, long renderTimeMs, String payloadFile) {
        this.key = key;
        this.payload = payload;
        this.byteSize = byteSize;
        this.createdAt = createdAt;
        this.lastAccessedAt = lastAccessedAt;
        this.renderTimeMs = renderTimeMs;
        this.payloadFile = payloadFile;
        this.accessSequence = ACCESS_SEQUENCE.incrementAndGet();
    }

    static CacheEntry rendered(PageKey key, BufferedImage image, Instant now, long renderTimeMs, String payloadFile) {
        return new CacheEntry(key, image, byteSizeOf(image), now, now, renderTimeMs, payloadFile);
    }

    static CacheEntry cold(PageDescriptor d) {
        CacheEntry entry = new CacheEntry(d.key(), null, d.byteSize(), d.createdAt(),
                d.lastAccessedAt(), d.renderTimeMs(), d.payloadFile());
        entry.persistedAccessAt = d.lastAccessedAt();
        return entry;
    }

    /** Same identity and history as a cold entry, now holding its pixels. */
    static CacheEntry warmed(CacheEntry cold, BufferedImage image) {
        CacheEntry entry = new CacheEntry(cold.key, image, byteSizeOf(image), cold.createdAt,
                cold.lastAccessedAt, cold.renderTimeMs, cold.payloadFile);
        entry.persistedAccessAt = cold.persistedAccessAt;
        entry.accessCount.set(cold.accessCount.get());
        entry.accessSequence = cold.accessSequence;
        return entry;
    }

    public static long byteSizeOf(BufferedImage image) {
        return (long) image.getWidth() * image.getHeight() * BYTES_PER_PIXEL;
    }

    // ------------------------------------------------------------- accessors

    public PageKey key() {
        return key;
    }

    /**
     * The rendered pixels.
     *
     * @throws IllegalStateException for a cold entry
     */
    public BufferedImage payload() {
        if (payload == null) {
            throw new IllegalStateException("Entry " + key + " is not resident");
        }
        return payload;
    }

    public boolean isResident() {
        return payload != null;
    }

    public long byteSize() {
        return byteSize;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    public long renderTimeMs() {
        return renderTimeMs;
    }

    public String payloadFile() {
        return payloadFile;
    }

    /** Position of the latest access among all entries; larger is more recent. */
    public long accessSequence() {
        return accessSequence;
    }

    public long accessCount() {
        return accessCount.get();
    }

    public int pinCount() {
        return pins.get();
    }

    public boolean isPinned() {
        return pins.get() > 0;
    }

    // ------------------------------------------------------------- pinning

    /** Give back the pin taken by {@code getOrRender}. Extra releases are ignored. */
    public void release() {
        pins.updateAndGet(p -> p > 0 ? p - 1 : 0);
    }

    @Override
    public void close() {
        release();
    }

    void pin(int count) {
        pins.addAndGet(count);
    }

    void touch(Instant now) {
        lastAccessedAt = now;
        accessSequence = ACCESS_SEQUENCE.incrementAndGet();
        accessCount.incrementAndGet();
    }

    // ---------------------------------------------------------- persistence

    boolean isDirty() {
        return payloadFile != null && !lastAccessedAt.equals(persistedAccessAt);
    }

    PageDescriptor toDescriptor() {
        return new PageDescriptor(key, byteSize, createdAt, lastAccessedAt, renderTimeMs, payloadFile);
    }

    void markPersisted(PageDescriptor descriptor) {
        persistedAccessAt = descriptor.lastAccessedAt();
    }

    @Override
    public String toString() {
        return "CacheEntry[" + key + ", " + byteSize + " bytes"
                + (isResident() ? "" : ", cold") + ", pins=" + pins.get() + "]";
    }
}
