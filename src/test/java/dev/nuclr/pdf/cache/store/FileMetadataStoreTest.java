package dev.nuclr.pdf.cache.store;

import dev.nuclr.pdf.cache.PageKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileMetadataStoreTest {

    private static final Instant T0 = Instant.parse("2026-02-01T08:30:00.123Z");

    @TempDir
    Path root;

    private PayloadStore payloads;
    private FileMetadataStore store;

    @BeforeEach
    void setUp() {
        payloads = new PayloadStore(root);
        store = new FileMetadataStore(root, payloads);
    }

    private PageDescriptor stored(PageKey key) throws Exception {
        String file = payloads.write(key, new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB));
        PageDescriptor descriptor = new PageDescriptor(key, 48, T0, T0.plusSeconds(90), 17, file);
        store.upsert(descriptor);
        return descriptor;
    }

    @Test
    void descriptorsSurviveReload() throws Exception {
        PageDescriptor first = stored(new PageKey("Quarterly Report.pdf", 0, 1.25f, 90));
        PageDescriptor second = stored(PageKey.of("other", 12, 2.0f));

        List<PageDescriptor> loaded = new FileMetadataStore(root, payloads).loadAll();

        assertThat(loaded).containsExactlyInAnyOrder(first, second);
    }

    @Test
    void upsertReplacesRecordOfSameKey() throws Exception {
        PageKey key = PageKey.of("a.pdf", 1, 1.0f);
        PageDescriptor old = stored(key);
        PageDescriptor touched = new PageDescriptor(key, old.byteSize(), old.createdAt(),
                old.lastAccessedAt().plusSeconds(600), old.renderTimeMs(), old.payloadFile());

        store.upsert(touched);

        assertThat(store.loadAll()).containsExactly(touched);
    }

    @Test
    void recordWithMissingPayloadIsDropped() throws Exception {
        PageDescriptor descriptor = stored(PageKey.of("a.pdf", 0, 1.0f));
        payloads.delete("a.pdf", descriptor.payloadFile());

        assertThat(store.loadAll()).isEmpty();
        assertThat(Files.exists(CacheLayout.recordFile(root, descriptor.key()))).isFalse();
    }

    @Test
    void corruptRecordIsDroppedAndOthersSurvive() throws Exception {
        PageDescriptor good = stored(PageKey.of("a.pdf", 0, 1.0f));
        PageDescriptor bad = stored(PageKey.of("a.pdf", 1, 1.0f));
        Files.writeString(CacheLayout.recordFile(root, bad.key()), "pageNumber=seven\n");

        assertThat(store.loadAll()).containsExactly(good);
        // the payload of the dropped record is an orphan now
        assertThat(Files.exists(CacheLayout.documentDirectory(root, "a.pdf").resolve(bad.payloadFile()))).isFalse();
    }

    @Test
    void strayTempFilesAndOrphanPayloadsAreRemoved() throws Exception {
        PageDescriptor good = stored(PageKey.of("a.pdf", 0, 1.0f));
        Path docDir = CacheLayout.documentDirectory(root, "a.pdf");
        Path tmp = docDir.resolve("page-3_scale-3f800000_rot-0.properties.tmp");
        Files.writeString(tmp, "partial");
        String orphan = payloads.write(PageKey.of("a.pdf", 5, 1.0f),
                new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB));

        assertThat(store.loadAll()).containsExactly(good);
        assertThat(Files.exists(tmp)).isFalse();
        assertThat(Files.exists(docDir.resolve(orphan))).isFalse();
    }

    @Test
    void leftoverTempFileNextToValidRecordIsRemoved() throws Exception {
        PageDescriptor good = stored(PageKey.of("a.pdf", 2, 1.0f));
        Path record = CacheLayout.recordFile(root, good.key());
        Path tmp = record.resolveSibling(record.getFileName() + CacheLayout.TEMP_SUFFIX);
        Files.writeString(tmp, "documentId=a.pdf\npageNu");

        assertThat(store.loadAll()).containsExactly(good);
        assertThat(tmp).doesNotExist();
        assertThat(record).exists();
    }

    @Test
    void recordFiledUnderAnotherDocumentIsDropped() throws Exception {
        PageDescriptor a = stored(PageKey.of("a.pdf", 0, 1.0f));
        PageDescriptor b = stored(PageKey.of("b.pdf", 0, 1.0f));
        Path misplaced = CacheLayout.documentDirectory(root, "b.pdf").resolve("page-9_scale-3f800000_rot-0.properties");
        Files.copy(CacheLayout.recordFile(root, a.key()), misplaced);

        assertThat(store.loadAll()).containsExactlyInAnyOrder(a, b);
        assertThat(misplaced).doesNotExist();
        assertThat(CacheLayout.recordFile(root, a.key())).exists();
    }

    @Test
    void recordFiledUnderAnotherPageNameIsDropped() throws Exception {
        PageDescriptor a = stored(PageKey.of("a.pdf", 0, 1.0f));
        Path renamed = CacheLayout.recordFile(root, PageKey.of("a.pdf", 7, 1.0f));
        Files.copy(CacheLayout.recordFile(root, a.key()), renamed);

        assertThat(store.loadAll()).containsExactly(a);
        assertThat(renamed).doesNotExist();
    }

    @Test
    void payloadFileEscapingTheDocumentDirectoryIsRejected() throws Exception {
        PageDescriptor descriptor = stored(PageKey.of("a.pdf", 0, 1.0f));
        PageDescriptor hostile = new PageDescriptor(descriptor.key(), 48, T0, T0, 0, "../../secret.png");
        store.upsert(hostile);

        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    void removalsDeleteRecordsAndDirectories() throws Exception {
        PageDescriptor a0 = stored(PageKey.of("a.pdf", 0, 1.0f));
        stored(PageKey.of("a.pdf", 1, 1.0f));
        stored(PageKey.of("b.pdf", 0, 1.0f));

        store.remove(a0.key());
        assertThat(store.loadAll()).hasSize(2);

        store.removeAllForDocument("a.pdf");
        assertThat(Files.exists(CacheLayout.documentDirectory(root, "a.pdf"))).isFalse();
        assertThat(store.loadAll()).hasSize(1);

        store.clearAll();
        assertThat(store.loadAll()).isEmpty();
        assertThat(Files.isDirectory(root)).isTrue();
    }

    @Test
    void emptyOrMissingRootLoadsNothing() throws Exception {
        assertThat(new FileMetadataStore(root.resolve("nowhere"), payloads).loadAll()).isEmpty();
        assertThat(store.loadAll()).isEmpty();
    }
}
