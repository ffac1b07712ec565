package dev.nuclr.pdf.cache.bridge;

import dev.nuclr.pdf.cache.RenderCacheManager;
import dev.nuclr.pdf.cache.RenderCacheSettings;
import dev.nuclr.pdf.cache.engine.PdfboxPageRenderer;
import dev.nuclr.pdf.cache.engine.TestPdfs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Timeout(60)
class PdfViewerBridgeTest {

    private static final String PDF = "manual.pdf";

    @TempDir
    Path dir;

    private PdfboxPageRenderer engine;
    private RenderCacheManager cache;
    private ExecutorService executor;
    private PdfViewerBridge bridge;

    @BeforeEach
    void setUp() throws Exception {
        engine = new PdfboxPageRenderer();
        engine.openDocument(PDF, TestPdfs.pages(6, 200, 100));
        RenderCacheSettings settings = RenderCacheSettings.defaults(dir)
                .withBudgetBytes(50_000_000)
                .withMaintenanceInterval(Duration.ZERO);
        cache = new RenderCacheManager(settings, engine);
        executor = Executors.newFixedThreadPool(2);
        bridge = new PdfViewerBridge(cache, engine, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        cache.close();
        engine.close();
    }

    private static Map<String, Object> await(CompletableFuture<Map<String, Object>> future) throws Exception {
        return future.get(30, TimeUnit.SECONDS);
    }

    @Test
    void renderPageDescribesBitmapAndServesRepeatsFromCache() throws Exception {
        Map<String, Object> first = await(bridge.renderPage(PDF, 0, 1.0, 0));

        assertThat(first)
                .containsEntry("success", true)
                .containsEntry("width", 400)
                .containsEntry("height", 200)
                .containsEntry("scale", 2.0)
                .containsEntry("byteSize", 320_000L)
                .containsEntry("fromCache", false);
        assertThat(first.get("image")).isInstanceOf(BufferedImage.class);

        Map<String, Object> second = await(bridge.renderPage(PDF, 0, 1.0, 0));
        assertThat(second).containsEntry("fromCache", true);
        assertThat(cache.metrics().pinnedEntries()).isZero();
    }

    @Test
    void renderFailureIsReportedNotThrown() throws Exception {
        Map<String, Object> result = await(bridge.renderPage(PDF, 42, 1.0, 0));

        assertThat(result)
                .containsEntry("success", false)
                .containsEntry("errorCode", PdfViewerBridge.RENDER_ERROR);
        assertThat((String) result.get("message")).contains("out of range");
    }

    @Test
    void malformedArgumentsMapToInvalidArgument() throws Exception {
        assertThat(await(bridge.renderPage(PDF, 0, 1.0, 45)))
                .containsEntry("errorCode", PdfViewerBridge.INVALID_ARGUMENT);
        assertThat(await(bridge.renderPage(" ", 0, 1.0, 0)))
                .containsEntry("errorCode", PdfViewerBridge.INVALID_ARGUMENT);
        assertThat(await(bridge.preloadPages(PDF, 4, 2)))
                .containsEntry("errorCode", PdfViewerBridge.INVALID_ARGUMENT);
        assertThat(await(bridge.clearCache(PDF, "thumbnails")))
                .containsEntry("errorCode", PdfViewerBridge.INVALID_ARGUMENT);
        assertThat(await(bridge.setRenderQuality(PDF, 7)))
                .containsEntry("errorCode", PdfViewerBridge.INVALID_ARGUMENT);
    }

    @Test
    void pageMetricsFollowRenderQuality() throws Exception {
        assertThat(await(bridge.getPageMetrics(PDF, 1)))
                .containsEntry("success", true)
                .containsEntry("widthPoints", 200.0)
                .containsEntry("heightPoints", 100.0)
                .containsEntry("width", 400)
                .containsEntry("renderQuality", 2);

        assertThat(await(bridge.setRenderQuality(PDF, 1))).containsEntry("success", true);
        assertThat(await(bridge.getPageMetrics(PDF, 1))).containsEntry("width", 200);
        assertThat(await(bridge.getPageMetrics(PDF, 99)))
                .containsEntry("errorCode", PdfViewerBridge.METRICS_ERROR);
    }

    @Test
    void preloadThenMetricsThenClear() throws Exception {
        assertThat(await(bridge.preloadPages(PDF, 0, 5)))
                .containsEntry("success", true)
                .containsEntry("cached", 6)
                .containsEntry("failed", 0)
                .containsEntry("partial", false);

        await(bridge.renderPage(PDF, 2, 1.0, 0));
        Map<String, Object> metrics = await(bridge.getCacheMetrics(PDF));
        assertThat(metrics)
                .containsEntry("entries", 6)
                .containsEntry("bytes", 6 * 320_000L)
                .containsEntry("hits", 1L);
        assertThat((double) metrics.get("hitRatio")).isBetween(0.0, 1.0);

        Map<String, Object> performance = await(bridge.getPerformanceMetrics(PDF));
        assertThat(performance).containsEntry("renderCount", 6L).containsEntry("renderFailures", 0L);

        assertThat(await(bridge.clearCache(PDF, "document")))
                .containsEntry("success", true)
                .containsEntry("scope", "document")
                .containsEntry("removedEntries", 6);
        assertThat(await(bridge.getCacheMetrics(null))).containsEntry("totalEntries", 0);
    }

    @Test
    void preloadReportsPagesPastTheEndAsFailures() throws Exception {
        assertThat(await(bridge.preloadPages(PDF, 4, 7)))
                .containsEntry("success", true)
                .containsEntry("cached", 2)
                .containsEntry("failed", 2)
                .containsEntry("partial", true);
    }

    @Test
    void optimizeMemoryTrimsCache() throws Exception {
        await(bridge.preloadPages(PDF, 0, 5));

        Map<String, Object> result = await(bridge.optimizeMemory(null));

        assertThat(result).containsEntry("success", true).containsEntry("evictedEntries", 0);
        assertThat(result).containsEntry("reachedLowWaterMark", true);
    }

    @Test
    void higherQualityRendersLargerBitmaps() throws Exception {
        await(bridge.setRenderQuality(PDF, 3));

        assertThat(await(bridge.renderPage(PDF, 0, 1.0, 90)))
                .containsEntry("scale", 2.75)
                .containsEntry("width", 275)
                .containsEntry("height", 550);
    }
}
