package dev.nuclr.pdf.cache.store;

import dev.nuclr.pdf.cache.PageKey;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * {@link MetadataStore} keeping one {@code .properties} record per cached page
 * under a directory per document. Records are replaced atomically via a temp
 * file and rename, so a crash leaves either the previous or the new record.
 *
 * <p>Writes to different records may run concurrently. Callers serialise writes
 * to the same document; {@link #loadAll()} must not run alongside writers.
 */
@Slf4j
public class FileMetadataStore implements MetadataStore {

    static final String KEY_DOCUMENT_ID   = "documentId";
    static final String KEY_PAGE_NUMBER   = "pageNumber";
    static final String KEY_SCALE         = "scale";
    static final String KEY_ROTATION      = "rotation";
    static final String KEY_BYTE_SIZE     = "byteSize";
    static final String KEY_CREATED_AT    = "createdAt";
    static final String KEY_LAST_ACCESSED = "lastAccessedAt";
    static final String KEY_RENDER_TIME   = "renderTimeMs";
    static final String KEY_PAYLOAD_FILE  = "payloadFile";

    private final Path root;
    private final PayloadStore payloads;

    public FileMetadataStore(Path root, PayloadStore payloads) {
        this.root = root;
        this.payloads = payloads;
    }

    // ------------------------------------------------------------- mutations

    @Override
    public void upsert(PageDescriptor descriptor) throws IOException {
        Properties props = toProperties(descriptor);
        Path file = CacheLayout.recordFile(root, descriptor.key());
        AtomicFiles.write(file, out -> props.store(out, "PDF render cache page descriptor"));
    }

    @Override
    public void remove(PageKey key) throws IOException {
        Files.deleteIfExists(CacheLayout.recordFile(root, key));
    }

    @Override
    public void removeAllForDocument(String documentId) throws IOException {
        AtomicFiles.deleteTree(CacheLayout.documentDirectory(root, documentId));
    }

    @Override
    public void clearAll() throws IOException {
        if (!Files.isDirectory(root)) {
            return;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                AtomicFiles.deleteTree(dir);
            }
        }
        log.info("Cleared render cache directory {}", root);
    }

    // ------------------------------------------------------------------ load

    @Override
    public List<PageDescriptor> loadAll() throws IOException {
        List<PageDescriptor> result = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return result;
        }
        int dropped = 0;
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                dropped += loadDocument(dir, result);
            }
        }
        log.info("Loaded {} page descriptors from {} ({} dropped)", result.size(), root, dropped);
        return result;
    }

    private int loadDocument(Path dir, List<PageDescriptor> result) throws IOException {
        int dropped = 0;
        Set<String> referencedPayloads = new HashSet<>();
        List<Path> payloadFiles = new ArrayList<>();

        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(CacheLayout.TEMP_SUFFIX)) {
                    // interrupted write
                    Files.deleteIfExists(file);
                } else if (name.endsWith(CacheLayout.PAYLOAD_SUFFIX)) {
                    payloadFiles.add(file);
                } else if (name.endsWith(CacheLayout.RECORD_SUFFIX)) {
                    PageDescriptor descriptor = readRecord(dir, file);
                    if (descriptor == null) {
                        dropped++;
                        Files.deleteIfExists(file);
                    } else if (!payloads.isReadable(descriptor.key().documentId(), descriptor.payloadFile())) {
                        log.warn("Dropping descriptor {}: payload {} missing or unreadable",
                                file.getFileName(), descriptor.payloadFile());
                        dropped++;
                        Files.deleteIfExists(file);
                    } else {
                        referencedPayloads.add(descriptor.payloadFile());
                        result.add(descriptor);
                    }
                }
            }
        }

        // payloads written before a crash that never got their descriptor
        for (Path payload : payloadFiles) {
            if (!referencedPayloads.contains(payload.getFileName().toString())) {
                log.debug("Removing orphaned payload {}", payload);
                Files.deleteIfExists(payload);
            }
        }
        return dropped;
    }

    /** Returns null when the record cannot be trusted. */
    private PageDescriptor readRecord(Path dir, Path file) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
            PageDescriptor descriptor = fromProperties(props);
            if (!CacheLayout.documentDirectory(root, descriptor.key().documentId()).equals(dir)) {
                throw new IllegalArgumentException("record belongs to another document directory");
            }
            if (!CacheLayout.recordFile(root, descriptor.key()).getFileName().equals(file.getFileName())) {
                throw new IllegalArgumentException("record is stored under another page's name");
            }
            return descriptor;
        } catch (IOException | IllegalArgumentException | DateTimeException e) {
            log.warn("Dropping corrupt cache descriptor {}: {}", file, e.getMessage());
            return null;
        }
    }

    // ------------------------------------------------------------ conversion

    static Properties toProperties(PageDescriptor d) {
        PageKey key = d.key();
        Properties props = new Properties();
        props.setProperty(KEY_DOCUMENT_ID,   key.documentId());
        props.setProperty(KEY_PAGE_NUMBER,   String.valueOf(key.pageNumber()));
        props.setProperty(KEY_SCALE,         Float.toString(key.scale()));
        props.setProperty(KEY_ROTATION,      String.valueOf(key.rotation()));
        props.setProperty(KEY_BYTE_SIZE,     String.valueOf(d.byteSize()));
        props.setProperty(KEY_CREATED_AT,    String.valueOf(d.createdAt().toEpochMilli()));
        props.setProperty(KEY_LAST_ACCESSED, String.valueOf(d.lastAccessedAt().toEpochMilli()));
        props.setProperty(KEY_RENDER_TIME,   String.valueOf(d.renderTimeMs()));
        props.setProperty(KEY_PAYLOAD_FILE,  d.payloadFile());
        return props;
    }

    static PageDescriptor fromProperties(Properties props) {
        PageKey key = new PageKey(
                required(props, KEY_DOCUMENT_ID),
                Integer.parseInt(required(props, KEY_PAGE_NUMBER)),
                Float.parseFloat(required(props, KEY_SCALE)),
                Integer.parseInt(required(props, KEY_ROTATION)));
        String payloadFile = required(props, KEY_PAYLOAD_FILE);
        if (payloadFile.contains("/") || payloadFile.contains("\\") || payloadFile.contains("..")) {
            throw new IllegalArgumentException("illegal payload file name " + payloadFile);
        }
        return new PageDescriptor(
                key,
                Long.parseLong(required(props, KEY_BYTE_SIZE)),
                Instant.ofEpochMilli(Long.parseLong(required(props, KEY_CREATED_AT))),
                Instant.ofEpochMilli(Long.parseLong(required(props, KEY_LAST_ACCESSED))),
                Long.parseLong(required(props, KEY_RENDER_TIME)),
                payloadFile);
    }

    private static String required(Properties props, String name) {
        String value = props.getProperty(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + name);
        }
        return value;
    }
}
