package dev.nuclr.pdf.cache.store;

import dev.nuclr.pdf.cache.PageKey;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * File naming for the cache directory:
 * {@code <root>/<documentHash>/<pageName>.properties} for descriptors and
 * {@code <root>/<documentHash>/<pageName>-<unique>.png} for payloads.
 */
public final class CacheLayout {

    public static final String RECORD_SUFFIX  = ".properties";
    public static final String PAYLOAD_SUFFIX = ".png";
    public static final String TEMP_SUFFIX    = ".tmp";

    private CacheLayout() {
    }

    /** Directory holding every file of one document. */
    public static Path documentDirectory(Path root, String documentId) {
        return root.resolve(documentHash(documentId));
    }

    /** Base name shared by a page's descriptor and its payload files. */
    public static String pageName(PageKey key) {
        return "page-" + key.pageNumber()
                + "_scale-" + Integer.toHexString(Float.floatToIntBits(key.scale()))
                + "_rot-" + key.rotation();
    }

    public static Path recordFile(Path root, PageKey key) {
        return documentDirectory(root, key.documentId()).resolve(pageName(key) + RECORD_SUFFIX);
    }

    public static String documentHash(String documentId) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(documentId.getBytes(StandardCharsets.UTF_8));
            return "doc-" + HexFormat.of().formatHex(hash, 0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
