package dev.nuclr.pdf.cache;

import dev.nuclr.pdf.cache.engine.EngineException;
import dev.nuclr.pdf.cache.engine.PageRenderer;
import dev.nuclr.pdf.cache.engine.PageSize;
import dev.nuclr.pdf.cache.engine.RenderedPage;

import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine that paints blank bitmaps of a fixed size. Pages can be made to fail,
 * every render can be slowed down, and single pages can be held until a gate
 * opens regardless of interrupts.
 */
public class StubRenderer implements PageRenderer {

    private final int width;
    private final int height;
    private volatile long delayMs;
    private final Set<Integer> failingPages = ConcurrentHashMap.newKeySet();
    private final Map<Integer, CountDownLatch> stalledPages = new ConcurrentHashMap<>();
    private final AtomicInteger renders = new AtomicInteger();

    public StubRenderer(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public StubRenderer delay(long millis) {
        this.delayMs = millis;
        return this;
    }

    public StubRenderer failOn(int pageNumber) {
        failingPages.add(pageNumber);
        return this;
    }

    /** Renders of {@code pageNumber} ignore interrupts and block until {@code gate} opens. */
    public StubRenderer stallUntil(int pageNumber, CountDownLatch gate) {
        stalledPages.put(pageNumber, gate);
        return this;
    }

    public int renders() {
        return renders.get();
    }

    /** Bytes one render of this engine occupies in the cache. */
    public long pageBytes() {
        return (long) width * height * CacheEntry.BYTES_PER_PIXEL;
    }

    @Override
    public RenderedPage render(String documentId, int pageNumber, float scale, int rotation) throws EngineException {
        renders.incrementAndGet();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EngineException("interrupted", e);
            }
        }
        CountDownLatch gate = stalledPages.get(pageNumber);
        if (gate != null) {
            awaitIgnoringInterrupts(gate);
        }
        if (failingPages.contains(pageNumber)) {
            throw new EngineException("Page " + pageNumber + " is damaged");
        }
        return new RenderedPage(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), delayMs);
    }

    @Override
    public PageSize pageSize(String documentId, int pageNumber) {
        return new PageSize(width, height);
    }

    private static void awaitIgnoringInterrupts(CountDownLatch gate) {
        boolean interrupted = false;
        while (true) {
            try {
                gate.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
