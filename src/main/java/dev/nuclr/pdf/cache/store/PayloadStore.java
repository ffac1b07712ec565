package dev.nuclr.pdf.cache.store;

import dev.nuclr.pdf.cache.PageKey;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.UUID;

/**
 * Stores rendered page payloads as PNG files. Each entry gets a file name of
 * its own, so deleting the payload of an evicted entry never touches the
 * payload of a newer entry for the same page.
 */
@Slf4j
public class PayloadStore {

    private final Path root;

    public PayloadStore(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    /**
     * Write the image and return the payload file name to record in the descriptor.
     */
    public String write(PageKey key, BufferedImage image) throws IOException {
        String fileName = CacheLayout.pageName(key) + "-"
                + UUID.randomUUID().toString().substring(0, 8) + CacheLayout.PAYLOAD_SUFFIX;
        Path target = CacheLayout.documentDirectory(root, key.documentId()).resolve(fileName);
        AtomicFiles.write(target, out -> {
            if (!ImageIO.write(image, "png", out)) {
                throw new IOException("No PNG writer available");
            }
        });
        log.debug("Wrote payload {} for page {} of {}", fileName, key.pageNumber(), key.documentId());
        return fileName;
    }

    public BufferedImage read(String documentId, String fileName) throws IOException {
        Path file = resolve(documentId, fileName);
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Unreadable payload " + file);
        }
        return image;
    }

    /**
     * Cheap integrity check: the file exists and its image header decodes.
     */
    public boolean isReadable(String documentId, String fileName) {
        Path file = resolve(documentId, fileName);
        if (!Files.isRegularFile(file)) {
            return false;
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) {
                return false;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return false;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return reader.getWidth(0) > 0 && reader.getHeight(0) > 0;
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.debug("Payload {} failed header check: {}", file, e.getMessage());
            return false;
        }
    }

    public void delete(String documentId, String fileName) throws IOException {
        Files.deleteIfExists(resolve(documentId, fileName));
    }

    Path resolve(String documentId, String fileName) {
        return CacheLayout.documentDirectory(root, documentId).resolve(fileName);
    }
}
