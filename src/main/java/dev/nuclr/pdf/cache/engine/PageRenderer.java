package dev.nuclr.pdf.cache.engine;

/**
 * Strategy interface for the engine that rasterises PDF pages.
 * Implementations must be thread-safe: the render cache calls them from
 * several worker threads at once, never holding its own lock.
 */
@FunctionalInterface
public interface PageRenderer {

    /**
     * Render one page of an open document.
     *
     * @param documentId document session the page belongs to
     * @param pageNumber 0-based page index
     * @param scale      1.0 renders at 72 DPI
     * @param rotation   clockwise rotation in degrees: 0, 90, 180 or 270
     * @throws EngineException if the engine cannot produce the page
     */
    RenderedPage render(String documentId, int pageNumber, float scale, int rotation) throws EngineException;

    /**
     * Page dimensions in PDF points, before scaling and rotation.
     * Engines that cannot answer without rendering may leave the default.
     */
    default PageSize pageSize(String documentId, int pageNumber) throws EngineException {
        throw new EngineException("Page size lookup not supported by " + name());
    }

    /** Human-readable name for logging. */
    default String name() {
        return getClass().getSimpleName();
    }
}
