package dev.nuclr.pdf.cache.store;

import dev.nuclr.pdf.cache.PageKey;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted description of one cache entry. Carries no pixels; the payload
 * lives in {@code payloadFile} next to the descriptor.
 */
public record PageDescriptor(
        PageKey key,
        long byteSize,
        Instant createdAt,
        Instant lastAccessedAt,
        long renderTimeMs,
        String payloadFile) {

    public PageDescriptor {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastAccessedAt, "lastAccessedAt");
        Objects.requireNonNull(payloadFile, "payloadFile");
        if (byteSize < 0) {
            throw new IllegalArgumentException("byteSize must be >= 0, was " + byteSize);
        }
    }
}
