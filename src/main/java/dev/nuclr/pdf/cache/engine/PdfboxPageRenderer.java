package dev.nuclr.pdf.cache.engine;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Page renderer backed by Apache PDFBox 3.x.
 *
 * <p>Documents are opened under a caller-chosen document id and stay open until
 * {@link #closeDocument(String)} or {@link #close()}. PDFBox renderers are not
 * thread-safe, so each document carries its own lock; different documents
 * render in parallel.
 */
@Slf4j
public class PdfboxPageRenderer implements PageRenderer, AutoCloseable {

    /** PDFBox renders at 72 DPI for a scale of 1.0. */
    static final float POINTS_PER_INCH = 72f;

    private final Map<String, OpenDocument> documents = new ConcurrentHashMap<>();

    private static final class OpenDocument {
        final PDDocument document;
        final PDFRenderer renderer;
        final ReentrantLock lock = new ReentrantLock();

        OpenDocument(PDDocument document) {
            this.document = document;
            this.renderer = new PDFRenderer(document);
            this.renderer.setSubsamplingAllowed(true);
        }
    }

    @Override
    public String name() {
        return "PDFBox";
    }

    // ------------------------------------------------------------ documents

    public PdfDocumentInfo openDocument(String documentId, byte[] pdfBytes) throws EngineException {
        PDDocument document;
        try {
            document = Loader.loadPDF(pdfBytes);
        } catch (InvalidPasswordException e) {
            throw new EngineException.EncryptedPdfException(documentId);
        } catch (IOException e) {
            throw new EngineException("Cannot open PDF " + documentId + ": " + e.getMessage(), e);
        }
        return register(documentId, document);
    }

    public PdfDocumentInfo openDocument(String documentId, Path file) throws EngineException {
        PDDocument document;
        try {
            document = Loader.loadPDF(file.toFile());
        } catch (InvalidPasswordException e) {
            throw new EngineException.EncryptedPdfException(documentId);
        } catch (IOException e) {
            throw new EngineException("Cannot open PDF " + file + ": " + e.getMessage(), e);
        }
        return register(documentId, document);
    }

    public boolean isOpen(String documentId) {
        return documents.containsKey(documentId);
    }

    /** Release all resources held for the document. Unknown ids are ignored. */
    public void closeDocument(String documentId) {
        OpenDocument open = documents.remove(documentId);
        if (open != null) {
            closeQuietly(documentId, open);
        }
    }

    @Override
    public void close() {
        for (String documentId : documents.keySet()) {
            closeDocument(documentId);
        }
    }

    // ------------------------------------------------------ PageRenderer impl

    @Override
    public RenderedPage render(String documentId, int pageNumber, float scale, int rotation) throws EngineException {
        OpenDocument open = require(documentId);
        long start = System.nanoTime();
        BufferedImage image;
        open.lock.lock();
        try {
            checkPage(documentId, open, pageNumber);
            log.debug("PDFBox: rendering page {} of {} at scale {}", pageNumber, documentId, scale);
            image = open.renderer.renderImageWithDPI(pageNumber, POINTS_PER_INCH * scale, ImageType.RGB);
        } catch (IOException e) {
            throw new EngineException("Failed to render page " + pageNumber + " of " + documentId, e);
        } finally {
            open.lock.unlock();
        }
        BufferedImage rotated = rotate(image, rotation);
        return new RenderedPage(rotated, (System.nanoTime() - start) / 1_000_000L);
    }

    @Override
    public PageSize pageSize(String documentId, int pageNumber) throws EngineException {
        OpenDocument open = require(documentId);
        open.lock.lock();
        try {
            checkPage(documentId, open, pageNumber);
            PDRectangle box = open.document.getPage(pageNumber).getCropBox();
            return new PageSize(box.getWidth(), box.getHeight());
        } finally {
            open.lock.unlock();
        }
    }

    // ---------------------------------------------------------------- helpers

    private PdfDocumentInfo register(String documentId, PDDocument document) {
        PDDocumentInformation docInfo = document.getDocumentInformation();
        String title  = sanitize(docInfo != null ? docInfo.getTitle()  : null);
        String author = sanitize(docInfo != null ? docInfo.getAuthor() : null);
        int    pages  = document.getNumberOfPages();
        String ver    = String.format("PDF %.1f", document.getVersion());

        OpenDocument previous = documents.put(documentId, new OpenDocument(document));
        if (previous != null) {
            log.info("Replacing open document {}", documentId);
            closeQuietly(documentId, previous);
        }
        log.info("Opened PDF {} via PDFBox: {} pages, {}", documentId, pages, ver);
        return new PdfDocumentInfo(documentId, title, author, pages, ver);
    }

    private OpenDocument require(String documentId) throws EngineException {
        OpenDocument open = documents.get(documentId);
        if (open == null) {
            throw new EngineException("Document not open: " + documentId);
        }
        return open;
    }

    private static void checkPage(String documentId, OpenDocument open, int pageNumber) throws EngineException {
        int pages = open.document.getNumberOfPages();
        if (pageNumber < 0 || pageNumber >= pages) {
            throw new EngineException("Page " + pageNumber + " out of range for " + documentId
                    + " (" + pages + " pages)");
        }
    }

    private static void closeQuietly(String documentId, OpenDocument open) {
        open.lock.lock();
        try {
            open.document.close();
        } catch (IOException e) {
            log.warn("Error closing PDDocument {}", documentId, e);
        } finally {
            open.lock.unlock();
        }
    }

    /** Rotate clockwise by a multiple of 90 degrees. */
    static BufferedImage rotate(BufferedImage src, int rotation) {
        if (rotation == 0) {
            return src;
        }
        int w = src.getWidth();
        int h = src.getHeight();
        boolean quarterTurn = rotation == 90 || rotation == 270;
        int type = src.getType() == BufferedImage.TYPE_CUSTOM ? BufferedImage.TYPE_INT_RGB : src.getType();
        BufferedImage out = new BufferedImage(quarterTurn ? h : w, quarterTurn ? w : h, type);

        AffineTransform transform = new AffineTransform();
        switch (rotation) {
            case 90  -> transform.translate(h, 0);
            case 180 -> transform.translate(w, h);
            case 270 -> transform.translate(0, w);
            default  -> throw new IllegalArgumentException("Unsupported rotation: " + rotation);
        }
        transform.rotate(Math.toRadians(rotation));

        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, transform, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static String sanitize(String s) {
        return (s != null && !s.isBlank()) ? s.trim() : null;
    }
}
