package dev.nuclr.pdf.cache;

import dev.nuclr.pdf.cache.store.PageDescriptor;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheEntryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void byteSizeCountsFourBytesPerPixel() {
        CacheEntry entry = CacheEntry.rendered(PageKey.of("a.pdf", 0, 1.0f),
                new BufferedImage(500, 200, BufferedImage.TYPE_INT_RGB), T0, 12, "p.png");

        assertThat(entry.byteSize()).isEqualTo(400_000);
        assertThat(entry.createdAt()).isEqualTo(T0);
        assertThat(entry.lastAccessedAt()).isEqualTo(T0);
        assertThat(entry.isResident()).isTrue();
    }

    @Test
    void releaseNeverDropsBelowZero() {
        CacheEntry entry = CacheEntry.rendered(PageKey.of("a.pdf", 0, 1.0f),
                new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB), T0, 0, null);
        entry.pin(2);

        entry.release();
        assertThat(entry.isPinned()).isTrue();
        entry.close();
        entry.release();
        assertThat(entry.pinCount()).isZero();
    }

    @Test
    void coldEntryHasNoPixelsAndIsNotDirty() {
        PageKey key = PageKey.of("a.pdf", 4, 2.0f);
        PageDescriptor descriptor = new PageDescriptor(key, 1_000, T0, T0.plusSeconds(5), 7, "x.png");
        CacheEntry cold = CacheEntry.cold(descriptor);

        assertThat(cold.isResident()).isFalse();
        assertThat(cold.byteSize()).isEqualTo(1_000);
        assertThat(cold.isDirty()).isFalse();
        assertThatThrownBy(cold::payload).isInstanceOf(IllegalStateException.class);

        cold.touch(T0.plusSeconds(60));
        assertThat(cold.isDirty()).isTrue();
        assertThat(cold.toDescriptor().lastAccessedAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void warmedEntryKeepsIdentityOfColdOne() {
        PageDescriptor descriptor = new PageDescriptor(PageKey.of("a.pdf", 1, 1.0f), 16, T0, T0, 3, "y.png");
        CacheEntry cold = CacheEntry.cold(descriptor);

        CacheEntry warm = CacheEntry.warmed(cold, new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB));

        assertThat(warm.isResident()).isTrue();
        assertThat(warm.key()).isEqualTo(cold.key());
        assertThat(warm.createdAt()).isEqualTo(T0);
        assertThat(warm.payloadFile()).isEqualTo("y.png");
        assertThat(warm.isDirty()).isFalse();
    }
}
