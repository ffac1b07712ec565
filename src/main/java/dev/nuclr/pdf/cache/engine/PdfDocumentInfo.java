package dev.nuclr.pdf.cache.engine;

/**
 * Metadata about a document opened by {@link PdfboxPageRenderer}.
 */
public record PdfDocumentInfo(
        String documentId,
        String title,
        String author,
        int pageCount,
        String pdfVersion) {
}
