package dev.nuclr.pdf.cache.store;

import dev.nuclr.pdf.cache.PageKey;

import java.io.IOException;
import java.util.List;

/**
 * Durable record of cache entry descriptors, scoped per document.
 *
 * <p>Every mutation is crash-atomic for a single descriptor: a partial write of
 * one descriptor never corrupts another. Metadata is a hint; {@link #loadAll()}
 * drops descriptors it cannot trust instead of failing.
 */
public interface MetadataStore {

    void upsert(PageDescriptor descriptor) throws IOException;

    void remove(PageKey key) throws IOException;

    /** Remove every descriptor and payload of the document. */
    void removeAllForDocument(String documentId) throws IOException;

    void clearAll() throws IOException;

    /**
     * Load every trustworthy descriptor. Records that fail to parse, and records
     * whose payload is missing or unreadable, are dropped from disk and skipped.
     */
    List<PageDescriptor> loadAll() throws IOException;
}
