package dev.nuclr.pdf.cache;

import dev.nuclr.pdf.cache.engine.PageRenderer;
import dev.nuclr.pdf.cache.engine.RenderedPage;
import dev.nuclr.pdf.cache.store.FileMetadataStore;
import dev.nuclr.pdf.cache.store.MetadataStore;
import dev.nuclr.pdf.cache.store.PageDescriptor;
import dev.nuclr.pdf.cache.store.PayloadStore;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches rendered PDF pages: lookup, single-flight miss fill through the
 * rendering engine, byte-budget eviction, persistence and maintenance.
 *
 * <p>All public methods are safe to call from any thread. One lock guards the
 * index, the in-flight markers and the counters; it is never held while the
 * engine renders or while files are read or written. Concurrent misses for
 * the same key share one render.
 *
 * <p>Preloads are superseded through a per-document epoch counter: a later
 * preload or an invalidation of the document makes the pages of earlier
 * batches that have not started yet skip. Renders already running finish and
 * populate the cache.
 *
 * <p>Instances are constructed explicitly and closed by their owner.
 */
@Slf4j
public class RenderCacheManager implements AutoCloseable {

    // ----------------------------------------------------------------- types

    /** Marker for a render in progress. Fields other than {@code result} are guarded by the lock. */
    private static final class InFlight {
        final CompletableFuture<CacheEntry> result = new CompletableFuture<>();
        int waiters;
        boolean done;
        CacheEntry entry;
    }

    private enum PageStatus { CACHED, FAILED, SKIPPED }

    private static final int RENDER_RUNNING   = 0;
    private static final int RENDER_DONE      = 1;
    private static final int RENDER_ABANDONED = 2;

    private record PageOutcome(int page, PageStatus status, String error) {}

    // -------------------------------------------------------------- state

    private final RenderCacheSettings settings;
    private final PageRenderer renderer;
    private final MetadataStore metadataStore;
    private final PayloadStore payloadStore;
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<PageKey, CacheEntry> index = new HashMap<>();
    private final Map<PageKey, InFlight> inFlight = new HashMap<>();
    private long totalBytes;
    private long hits;
    private long misses;
    private long evictionCount;
    private long coalescedWaits;
    private long renderCount;
    private long renderFailures;
    private long renderTimeouts;
    private long overBudgetInserts;
    private long expiredEntries;
    private long totalRenderTimeMs;

    /** Serialises descriptor writes per document. Acquired before {@link #lock}, never after. */
    private final Map<String, ReentrantLock> documentLocks = new ConcurrentHashMap<>();

    private final Map<String, RenderQuality> qualities = new ConcurrentHashMap<>();

    /** Incremented on every preload or invalidation of a document to cancel queued preload pages. */
    private final Map<String, AtomicLong> preloadEpochs = new ConcurrentHashMap<>();
    private final AtomicLong globalEpoch = new AtomicLong();

    private final ThreadPoolExecutor renderExecutor;
    /** Renders that outlived their timeout and still occupy a render thread. */
    private final AtomicInteger abandonedRenders = new AtomicInteger();
    private final ExecutorService preloadExecutor;
    private final ScheduledExecutorService maintenanceExecutor;
    private final AtomicBoolean closed = new AtomicBoolean();

    // ----------------------------------------------------------- constructors

    public RenderCacheManager(RenderCacheSettings settings, PageRenderer renderer) {
        this(settings, renderer, new PayloadStore(settings.cacheDirectory()), Clock.systemUTC());
    }

    public RenderCacheManager(RenderCacheSettings settings, PageRenderer renderer,
                              PayloadStore payloadStore, Clock clock) {
        this(settings, renderer, new FileMetadataStore(settings.cacheDirectory(), payloadStore),
                payloadStore, new LruEvictionPolicy(), clock);
    }

    public RenderCacheManager(RenderCacheSettings settings,
                              PageRenderer renderer,
                              MetadataStore metadataStore,
                              PayloadStore payloadStore,
                              EvictionPolicy evictionPolicy,
                              Clock clock) {
        this.settings       = Objects.requireNonNull(settings, "settings");
        this.renderer       = Objects.requireNonNull(renderer, "renderer");
        this.metadataStore  = Objects.requireNonNull(metadataStore, "metadataStore");
        this.payloadStore   = Objects.requireNonNull(payloadStore, "payloadStore");
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy");
        this.clock          = Objects.requireNonNull(clock, "clock");

        int threads = settings.renderThreads();
        this.renderExecutor  = new ThreadPoolExecutor(threads, threads * 2, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("pdf-render"));
        this.preloadExecutor = Executors.newFixedThreadPool(settings.preloadThreads(), daemonThreads("pdf-preload"));

        restore();

        if (settings.maintenanceInterval().isZero()) {
            this.maintenanceExecutor = null;
        } else {
            long period = settings.maintenanceInterval().toMillis();
            this.maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("pdf-cache-maintenance"));
            this.maintenanceExecutor.scheduleWithFixedDelay(this::runMaintenance, period, period, TimeUnit.MILLISECONDS);
        }
    }

    public RenderCacheSettings getSettings() {
        return settings;
    }

    // ------------------------------------------------------------ lookups

    /**
     * Return the cached render for {@code key}, rendering it with the configured
     * engine on a miss. The returned entry is pinned; release it when done.
     */
    public CacheEntry getOrRender(PageKey key) throws RenderFailureException {
        return getOrRender(key, renderer);
    }

    /**
     * Return the cached render for {@code key}, rendering it with {@code engine}
     * on a miss. Concurrent calls for the same key share one render and receive
     * the same entry. The returned entry is pinned; release it when done.
     *
     * @throws RenderFailureException if the render fails or times out; the cache is unchanged
     */
    public CacheEntry getOrRender(PageKey key, PageRenderer engine) throws RenderFailureException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(engine, "engine");

        InFlight flight;
        CacheEntry cold = null;
        boolean owner = false;

        lock.lock();
        try {
            CacheEntry entry = index.get(key);
            if (entry != null && entry.isResident()) {
                entry.pin(1);
                entry.touch(now());
                hits++;
                log.debug("Cache hit: page {} of {}", key.pageNumber(), key.documentId());
                return entry;
            }
            flight = inFlight.get(key);
            if (flight != null) {
                flight.waiters++;
                coalescedWaits++;
            } else {
                flight = new InFlight();
                inFlight.put(key, flight);
                owner = true;
                if (entry != null) {
                    cold = entry;
                } else {
                    misses++;
                }
            }
        } finally {
            lock.unlock();
        }

        return owner ? fill(key, flight, cold, engine) : await(key, flight);
    }

    /**
     * Render a page at the document's current render quality: the effective
     * scale is {@code baseScale} times the quality's scale factor.
     */
    public CacheEntry renderPage(String documentId, int pageNumber, float baseScale, int rotation)
            throws RenderFailureException {
        return getOrRender(keyFor(documentId, pageNumber, baseScale, rotation));
    }

    /** The key {@link #renderPage} would use right now. */
    public PageKey keyFor(String documentId, int pageNumber, float baseScale, int rotation) {
        requireDocumentId(documentId);
        return new PageKey(documentId, pageNumber, getRenderQuality(documentId).apply(baseScale), rotation);
    }

    // ------------------------------------------------------------ preload

    /**
     * Render pages {@code startPage..endPage} (both inclusive) in the background
     * at the document's current quality. Returns immediately. Per-page failures
     * are reported in the result, never raised. Ranges longer than
     * {@code maxPreloadPages} are capped; the remainder is reported as skipped.
     */
    public CompletableFuture<PreloadResult> preload(String documentId, int startPage, int endPage) {
        ensureOpen();
        requireDocumentId(documentId);
        if (startPage < 0 || endPage < startPage) {
            throw new InvalidKeyException("Invalid page range " + startPage + ".." + endPage);
        }
        int lastPage = endPage;
        if ((long) endPage - startPage + 1 > settings.maxPreloadPages()) {
            lastPage = startPage + settings.maxPreloadPages() - 1;
            log.warn("Preload of {} pages {}..{} capped at {}..{}",
                    documentId, startPage, endPage, startPage, lastPage);
        }

        long docEpoch = preloadEpoch(documentId).incrementAndGet();
        long global = globalEpoch.get();
        float scale = getRenderQuality(documentId).apply(1.0f);

        List<CompletableFuture<PageOutcome>> pages = new ArrayList<>();
        for (int page = startPage; page <= lastPage; page++) {
            PageKey key = new PageKey(documentId, page, scale, 0);
            pages.add(CompletableFuture.supplyAsync(() -> preloadPage(key, docEpoch, global), preloadExecutor));
        }
        for (int page = lastPage + 1; page <= endPage; page++) {
            pages.add(CompletableFuture.completedFuture(new PageOutcome(page, PageStatus.SKIPPED, null)));
        }
        log.info("Preloading pages {}..{} of {}", startPage, lastPage, documentId);

        return CompletableFuture.allOf(pages.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> summarize(documentId, pages));
    }

    private PageOutcome preloadPage(PageKey key, long docEpoch, long global) {
        if (closed.get() || isSuperseded(key.documentId(), docEpoch, global)) {
            return new PageOutcome(key.pageNumber(), PageStatus.SKIPPED, null);
        }
        try (CacheEntry ignored = getOrRender(key, renderer)) {
            return new PageOutcome(key.pageNumber(), PageStatus.CACHED, null);
        } catch (RenderFailureException e) {
            log.warn("Preload of page {} of {} failed: {}", key.pageNumber(), key.documentId(), e.getMessage());
            return new PageOutcome(key.pageNumber(), PageStatus.FAILED, e.getMessage());
        }
    }

    private PreloadResult summarize(String documentId, List<CompletableFuture<PageOutcome>> pages) {
        List<Integer> cached = new ArrayList<>();
        Map<Integer, String> failed = new TreeMap<>();
        List<Integer> skipped = new ArrayList<>();
        pages.stream()
                .map(CompletableFuture::join)
                .sorted(Comparator.comparingInt(PageOutcome::page))
                .forEach(o -> {
                    switch (o.status()) {
                        case CACHED  -> cached.add(o.page());
                        case FAILED  -> failed.put(o.page(), String.valueOf(o.error()));
                        case SKIPPED -> skipped.add(o.page());
                    }
                });
        PreloadResult result = new PreloadResult(documentId, cached, failed, skipped);
        log.info("Preload of {} finished: {} cached, {} failed, {} skipped",
                documentId, cached.size(), failed.size(), skipped.size());
        return result;
    }

    private AtomicLong preloadEpoch(String documentId) {
        return preloadEpochs.computeIfAbsent(documentId, id -> new AtomicLong());
    }

    private boolean isSuperseded(String documentId, long docEpoch, long global) {
        return preloadEpoch(documentId).get() != docEpoch || globalEpoch.get() != global;
    }

    // ------------------------------------------------------- invalidation

    /**
     * Remove cached pages. Safe to repeat; a second call finds nothing to remove.
     *
     * @param documentId ignored for {@link InvalidationScope#ALL}
     * @return number of entries removed
     */
    public int invalidate(String documentId, InvalidationScope scope) {
        Objects.requireNonNull(scope, "scope");
        boolean all = scope == InvalidationScope.ALL;
        if (!all) {
            requireDocumentId(documentId);
        }

        List<CacheEntry> discarded = new ArrayList<>();
        boolean quiescent;
        lock.lock();
        try {
            Iterator<CacheEntry> it = index.values().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next();
                if (all || entry.key().belongsTo(documentId)) {
                    it.remove();
                    totalBytes -= entry.byteSize();
                    discarded.add(entry);
                }
            }
            if (all) {
                resetCountersLocked();
            }
            quiescent = index.isEmpty() && inFlight.isEmpty();
        } finally {
            lock.unlock();
        }

        if (all) {
            globalEpoch.incrementAndGet();
            qualities.clear();
        } else {
            preloadEpoch(documentId).incrementAndGet();
            if (scope == InvalidationScope.DOCUMENT) {
                qualities.remove(documentId);
            }
        }

        discard(discarded);
        if (all) {
            if (quiescent) {
                try {
                    metadataStore.clearAll();
                } catch (IOException e) {
                    log.warn("Could not clear render cache directory: {}", e.getMessage());
                }
            }
        } else {
            sweepDocument(documentId);
        }

        log.info("Invalidated {} cached pages ({}, scope {})",
                discarded.size(), all ? "all documents" : documentId, scope);
        return discarded.size();
    }

    /** Remove every scale and rotation variant of one page. */
    public int invalidatePage(String documentId, int pageNumber) {
        requireDocumentId(documentId);
        List<CacheEntry> discarded = new ArrayList<>();
        lock.lock();
        try {
            Iterator<CacheEntry> it = index.values().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next();
                if (entry.key().belongsTo(documentId) && entry.key().pageNumber() == pageNumber) {
                    it.remove();
                    totalBytes -= entry.byteSize();
                    discarded.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        discard(discarded);
        log.debug("Invalidated {} variants of page {} of {}", discarded.size(), pageNumber, documentId);
        return discarded.size();
    }

    // -------------------------------------------------------- maintenance

    /**
     * Evict unpinned entries, least recently used first, until the cache is at
     * or below its low-water mark. With a document id only that document's
     * entries are candidates. Runs a single pass.
     */
    public OptimizeResult optimizeMemory(String documentId) {
        long lowWater = settings.lowWaterMarkBytes();
        List<CacheEntry> discarded = new ArrayList<>();
        long freed = 0;
        long after;
        lock.lock();
        try {
            long excess = totalBytes - lowWater;
            if (excess > 0) {
                Collection<CacheEntry> candidates = documentId == null ? index.values() : entriesOfLocked(documentId);
                freed = evictLocked(candidates, excess, discarded);
            }
            after = totalBytes;
        } finally {
            lock.unlock();
        }
        discard(discarded);

        if (after > lowWater) {
            log.info("Memory optimisation of {} freed {} bytes in {} entries; {} bytes remain above the low-water mark",
                    documentId == null ? "all documents" : documentId, freed, discarded.size(), after - lowWater);
        } else {
            log.info("Memory optimisation of {} freed {} bytes in {} entries",
                    documentId == null ? "all documents" : documentId, freed, discarded.size());
        }
        return new OptimizeResult(documentId, discarded.size(), freed, after, lowWater);
    }

    /** Drop unpinned entries created longer ago than the configured TTL. */
    public int purgeExpired() {
        Instant cutoff = now().minus(settings.entryTtl());
        List<CacheEntry> discarded = new ArrayList<>();
        lock.lock();
        try {
            Iterator<CacheEntry> it = index.values().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next();
                if (!entry.isPinned() && entry.createdAt().isBefore(cutoff)) {
                    it.remove();
                    totalBytes -= entry.byteSize();
                    expiredEntries++;
                    discarded.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        discard(discarded);
        if (!discarded.isEmpty()) {
            log.info("Purged {} expired cached pages", discarded.size());
        }
        return discarded.size();
    }

    /** Write descriptors whose access time changed since they were last persisted. */
    public int flush() {
        List<CacheEntry> dirty = new ArrayList<>();
        lock.lock();
        try {
            for (CacheEntry entry : index.values()) {
                if (entry.isDirty()) {
                    dirty.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        dirty.forEach(this::persist);
        return dirty.size();
    }

    private void runMaintenance() {
        try {
            purgeExpired();
            flush();
        } catch (RuntimeException e) {
            log.error("Render cache maintenance failed", e);
        }
    }

    // ------------------------------------------------------------ metrics

    public CacheStats metrics() {
        lock.lock();
        try {
            int pinned = 0;
            for (CacheEntry entry : index.values()) {
                if (entry.isPinned()) {
                    pinned++;
                }
            }
            return new CacheStats(hits, misses, totalBytes, index.size(), evictionCount,
                    settings.budgetBytes(), pinned, coalescedWaits, renderCount, renderFailures,
                    renderTimeouts, overBudgetInserts, expiredEntries, totalRenderTimeMs);
        } finally {
            lock.unlock();
        }
    }

    public DocumentCacheStats metrics(String documentId) {
        requireDocumentId(documentId);
        int entries = 0;
        int resident = 0;
        int pinned = 0;
        long bytes = 0;
        lock.lock();
        try {
            for (CacheEntry entry : index.values()) {
                if (entry.key().belongsTo(documentId)) {
                    entries++;
                    bytes += entry.byteSize();
                    if (entry.isResident()) {
                        resident++;
                    }
                    if (entry.isPinned()) {
                        pinned++;
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        return new DocumentCacheStats(documentId, entries, resident, bytes, pinned, getRenderQuality(documentId));
    }

    // ------------------------------------------------------------ quality

    /** Affects renders issued after this call; cached entries are untouched. */
    public void setRenderQuality(String documentId, RenderQuality quality) {
        requireDocumentId(documentId);
        Objects.requireNonNull(quality, "quality");
        RenderQuality previous = qualities.put(documentId, quality);
        if (previous != quality) {
            log.info("Render quality of {} set to {}", documentId, quality);
        }
    }

    public RenderQuality getRenderQuality(String documentId) {
        return qualities.getOrDefault(documentId, settings.defaultQuality());
    }

    // ---------------------------------------------------------- lifecycle

    /**
     * Stop background work and flush descriptors. Renders already running are
     * given a few seconds to finish.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        globalEpoch.incrementAndGet();
        if (maintenanceExecutor != null) {
            maintenanceExecutor.shutdownNow();
        }
        preloadExecutor.shutdown();
        renderExecutor.shutdown();
        try {
            if (!preloadExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                preloadExecutor.shutdownNow();
            }
            if (!renderExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                renderExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int flushed = flush();
        CacheStats stats = metrics();
        log.info("Render cache closed: {} entries, {} bytes, {} descriptors flushed",
                stats.entryCount(), stats.totalBytes(), flushed);
    }

    public boolean isClosed() {
        return closed.get();
    }

    // -------------------------------------------------- internal miss fill

    private CacheEntry fill(PageKey key, InFlight flight, CacheEntry cold, PageRenderer engine)
            throws RenderFailureException {
        try {
            CacheEntry created = cold != null ? warm(key, cold) : null;
            boolean rendered = created == null;
            if (rendered) {
                if (cold != null) {
                    countMiss();
                }
                created = renderNew(key, engine);
            }
            return commit(key, flight, created, rendered);
        } catch (RenderFailureException | RuntimeException e) {
            abandon(key, flight, e);
            throw e;
        }
    }

    /** Read a cold entry's pixels back from disk. Returns null when they are gone. */
    private CacheEntry warm(PageKey key, CacheEntry cold) {
        if (cold.payloadFile() == null) {
            return null;
        }
        try {
            BufferedImage image = payloadStore.read(key.documentId(), cold.payloadFile());
            log.debug("Restored payload of page {} of {} from disk", key.pageNumber(), key.documentId());
            return CacheEntry.warmed(cold, image);
        } catch (IOException e) {
            log.warn("Payload of page {} of {} unreadable, rendering again: {}",
                    key.pageNumber(), key.documentId(), e.getMessage());
            return null;
        }
    }

    /**
     * Run the engine on a render thread. The timeout counts from the moment the
     * engine is called, not from submission. A render that outlives it is
     * interrupted and abandoned; while it keeps running the pool gets an extra
     * thread in its place, up to twice the configured count.
     */
    private CacheEntry renderNew(PageKey key, PageRenderer engine) throws RenderFailureException {
        int threads = settings.renderThreads();
        int abandoned = abandonedRenders.get();
        if (abandoned >= threads * 2) {
            log.warn("Not rendering page {} of {}: {} earlier renders are still running past their timeout",
                    key.pageNumber(), key.documentId(), abandoned);
            throw failure(key, "Rendering engine saturated: " + abandoned
                    + " renders still running past their timeout", null, false);
        }

        CompletableFuture<Long> started = new CompletableFuture<>();
        AtomicInteger state = new AtomicInteger(RENDER_RUNNING);
        Future<RenderedPage> task;
        try {
            task = renderExecutor.submit(() -> {
                started.complete(System.nanoTime());
                try {
                    return engine.render(key.documentId(), key.pageNumber(), key.scale(), key.rotation());
                } finally {
                    if (!state.compareAndSet(RENDER_RUNNING, RENDER_DONE)) {
                        abandonedRenders.decrementAndGet();
                        resizeRenderPool();
                        log.info("Abandoned render of page {} of {} has finished", key.pageNumber(), key.documentId());
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            throw failure(key, "Render cache is closed", e, false);
        }

        long timeoutMs = settings.renderTimeout().toMillis();
        RenderedPage page;
        try {
            long startedAt = awaitStart(key, started, task);
            long remainingMs = timeoutMs - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            page = task.get(Math.max(remainingMs, 0), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (state.compareAndSet(RENDER_RUNNING, RENDER_ABANDONED)) {
                abandonedRenders.incrementAndGet();
                resizeRenderPool();
            }
            task.cancel(true);
            log.warn("Render of page {} of {} timed out after {} ms", key.pageNumber(), key.documentId(), timeoutMs);
            throw failure(key, "Render timed out after " + timeoutMs + " ms", e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Error rendering page {} of {}", key.pageNumber(), key.documentId(), cause);
            throw failure(key, "Render failed: " + cause.getMessage(), cause, false);
        } catch (InterruptedException e) {
            if (started.isDone() && state.compareAndSet(RENDER_RUNNING, RENDER_ABANDONED)) {
                abandonedRenders.incrementAndGet();
                resizeRenderPool();
            }
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw failure(key, "Interrupted while rendering", e, false);
        }
        if (page == null) {
            throw failure(key, "Engine " + engine.name() + " returned no page", null, false);
        }

        String payloadFile = null;
        try {
            payloadFile = payloadStore.write(key, page.image());
        } catch (IOException e) {
            log.warn("Could not persist payload of page {} of {}: {}",
                    key.pageNumber(), key.documentId(), e.getMessage());
        }
        return CacheEntry.rendered(key, page.image(), now(), page.renderTimeMs(), payloadFile);
    }

    /** Wait until a render thread picks the task up. Returns the start time in nanos. */
    private long awaitStart(PageKey key, CompletableFuture<Long> started, Future<RenderedPage> task)
            throws InterruptedException, RenderFailureException {
        while (true) {
            try {
                return started.get(100, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (renderExecutor.isTerminated() || task.isCancelled()) {
                    task.cancel(false);
                    throw failure(key, "Render cache is closed", null, false);
                }
            } catch (ExecutionException e) {
                throw new IllegalStateException("Render start signal failed", e);
            }
        }
    }

    /** One extra render thread per abandoned render, at most the configured count again. */
    private void resizeRenderPool() {
        lock.lock();
        try {
            if (renderExecutor.isShutdown()) {
                return;
            }
            int threads = settings.renderThreads();
            renderExecutor.setCorePoolSize(Math.min(threads + abandonedRenders.get(), threads * 2));
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry commit(PageKey key, InFlight flight, CacheEntry created, boolean rendered) {
        List<CacheEntry> discarded = new ArrayList<>();
        lock.lock();
        try {
            CacheEntry existing = index.remove(key);
            if (existing != null) {
                totalBytes -= existing.byteSize();
                if (!Objects.equals(existing.payloadFile(), created.payloadFile())) {
                    discarded.add(existing);
                }
            }
            if (rendered) {
                renderCount++;
                totalRenderTimeMs += created.renderTimeMs();
            } else {
                hits++;
            }
            created.touch(now());

            makeRoomLocked(key, created.byteSize(), discarded);
            index.put(key, created);
            totalBytes += created.byteSize();

            // one pin for the owner and one for every coalesced waiter
            created.pin(1 + flight.waiters);
            hits += flight.waiters;
            inFlight.remove(key);
            flight.done = true;
            flight.entry = created;
        } finally {
            lock.unlock();
        }
        flight.result.complete(created);

        discard(discarded);
        persist(created);
        return created;
    }

    private CacheEntry await(PageKey key, InFlight flight) throws RenderFailureException {
        try {
            return flight.result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RenderFailureException failure) {
                throw new RenderFailureException(key, failure.getMessage(), failure, failure.isTimedOut());
            }
            throw new RenderFailureException(key, "Render failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lock.lock();
            try {
                if (!flight.done) {
                    flight.waiters--;
                } else if (flight.entry != null) {
                    flight.entry.release();
                }
            } finally {
                lock.unlock();
            }
            throw new RenderFailureException(key, "Interrupted while waiting for render", e);
        }
    }

    private void abandon(PageKey key, InFlight flight, Exception cause) {
        lock.lock();
        try {
            inFlight.remove(key, flight);
            flight.done = true;
        } finally {
            lock.unlock();
        }
        flight.result.completeExceptionally(cause);
    }

    private RenderFailureException failure(PageKey key, String message, Throwable cause, boolean timedOut) {
        lock.lock();
        try {
            renderFailures++;
            if (timedOut) {
                renderTimeouts++;
            }
        } finally {
            lock.unlock();
        }
        return new RenderFailureException(key, message, cause, timedOut);
    }

    private void countMiss() {
        lock.lock();
        try {
            misses++;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------ eviction

    /** Must be called with lock held. */
    private void makeRoomLocked(PageKey incoming, long incomingBytes, List<CacheEntry> discarded) {
        long overflow = totalBytes + incomingBytes - settings.budgetBytes();
        if (overflow <= 0) {
            return;
        }
        long freed = evictLocked(index.values(), overflow, discarded);
        if (freed < overflow) {
            overBudgetInserts++;
            log.info("Inserting page {} of {} {} bytes over budget: {}", incoming.pageNumber(),
                    incoming.documentId(), overflow - freed, overBudgetReason(incomingBytes, settings.budgetBytes()));
        }
    }

    static String overBudgetReason(long incomingBytes, long budgetBytes) {
        return incomingBytes > budgetBytes
                ? "the page alone needs " + incomingBytes + " bytes of a " + budgetBytes + " byte budget"
                : "remaining entries are pinned";
    }

    /** Must be called with lock held. Returns the bytes freed. */
    private long evictLocked(Collection<CacheEntry> candidates, long bytesToFree, List<CacheEntry> discarded) {
        List<CacheEntry> victims = evictionPolicy.selectVictims(candidates, bytesToFree);
        long freed = 0;
        for (CacheEntry victim : victims) {
            if (victim.isPinned() || !index.remove(victim.key(), victim)) {
                continue;
            }
            totalBytes -= victim.byteSize();
            evictionCount++;
            freed += victim.byteSize();
            discarded.add(victim);
            log.debug("Evicted page {} of {} ({} bytes)",
                    victim.key().pageNumber(), victim.key().documentId(), victim.byteSize());
        }
        return freed;
    }

    /** Must be called with lock held. */
    private List<CacheEntry> entriesOfLocked(String documentId) {
        List<CacheEntry> entries = new ArrayList<>();
        for (CacheEntry entry : index.values()) {
            if (entry.key().belongsTo(documentId)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    /** Must be called with lock held. */
    private void resetCountersLocked() {
        hits = 0;
        misses = 0;
        evictionCount = 0;
        coalescedWaits = 0;
        renderCount = 0;
        renderFailures = 0;
        renderTimeouts = 0;
        overBudgetInserts = 0;
        expiredEntries = 0;
        totalRenderTimeMs = 0;
    }

    // --------------------------------------------------------- persistence

    private void restore() {
        List<PageDescriptor> descriptors;
        try {
            descriptors = metadataStore.loadAll();
        } catch (IOException e) {
            log.warn("Could not load render cache metadata from {}, starting empty: {}",
                    settings.cacheDirectory(), e.getMessage());
            return;
        }

        Instant cutoff = now().minus(settings.entryTtl());
        List<CacheEntry> discarded = new ArrayList<>();
        int restored;
        long bytes;
        lock.lock();
        try {
            for (PageDescriptor descriptor : descriptors) {
                CacheEntry entry = CacheEntry.cold(descriptor);
                if (descriptor.createdAt().isBefore(cutoff)) {
                    expiredEntries++;
                    discarded.add(entry);
                    continue;
                }
                CacheEntry previous = index.put(descriptor.key(), entry);
                if (previous != null) {
                    totalBytes -= previous.byteSize();
                    discarded.add(previous);
                }
                totalBytes += entry.byteSize();
            }
            if (totalBytes > settings.budgetBytes()) {
                evictLocked(index.values(), totalBytes - settings.budgetBytes(), discarded);
            }
            restored = index.size();
            bytes = totalBytes;
        } finally {
            lock.unlock();
        }
        discard(discarded);
        log.info("Restored {} cached pages ({} bytes) from {}", restored, bytes, settings.cacheDirectory());
    }

    /** Write the descriptor of a live entry. Entries evicted in the meantime are skipped. */
    private void persist(CacheEntry entry) {
        if (entry.payloadFile() == null) {
            return;
        }
        PageKey key = entry.key();
        ReentrantLock documentLock = documentLock(key.documentId());
        documentLock.lock();
        try {
            PageDescriptor descriptor;
            lock.lock();
            try {
                if (index.get(key) != entry) {
                    return;
                }
                descriptor = entry.toDescriptor();
            } finally {
                lock.unlock();
            }
            metadataStore.upsert(descriptor);
            entry.markPersisted(descriptor);
        } catch (IOException e) {
            log.warn("Could not persist descriptor of page {} of {}: {}",
                    key.pageNumber(), key.documentId(), e.getMessage());
        } finally {
            documentLock.unlock();
        }
    }

    /** Delete the files of entries already removed from the index. */
    private void discard(List<CacheEntry> entries) {
        for (CacheEntry entry : entries) {
            PageKey key = entry.key();
            ReentrantLock documentLock = documentLock(key.documentId());
            documentLock.lock();
            try {
                // a newer entry for the same key owns the record
                if (!isLive(key)) {
                    metadataStore.remove(key);
                }
                if (entry.payloadFile() != null) {
                    payloadStore.delete(key.documentId(), entry.payloadFile());
                }
            } catch (IOException e) {
                log.warn("Could not remove cached files of page {} of {}: {}",
                        key.pageNumber(), key.documentId(), e.getMessage());
            } finally {
                documentLock.unlock();
            }
        }
    }

    /** Remove leftover files of a document that no longer has live or in-flight entries. */
    private void sweepDocument(String documentId) {
        ReentrantLock documentLock = documentLock(documentId);
        documentLock.lock();
        try {
            boolean unused;
            lock.lock();
            try {
                unused = index.keySet().stream().noneMatch(k -> k.belongsTo(documentId))
                        && inFlight.keySet().stream().noneMatch(k -> k.belongsTo(documentId));
            } finally {
                lock.unlock();
            }
            if (unused) {
                metadataStore.removeAllForDocument(documentId);
            }
        } catch (IOException e) {
            log.warn("Could not remove cache directory of {}: {}", documentId, e.getMessage());
        } finally {
            documentLock.unlock();
        }
    }

    private boolean isLive(PageKey key) {
        lock.lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock documentLock(String documentId) {
        return documentLocks.computeIfAbsent(documentId, id -> new ReentrantLock());
    }

    // ---------------------------------------------------------------- helpers

    private Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Render cache manager is closed");
        }
    }

    private static void requireDocumentId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidKeyException("documentId must not be blank");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
