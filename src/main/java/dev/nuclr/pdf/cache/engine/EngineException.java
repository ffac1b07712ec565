package dev.nuclr.pdf.cache.engine;

/**
 * Raised by a {@link PageRenderer} when a document cannot be opened or a page
 * cannot be rendered.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Thrown when the PDF requires a password. */
    public static class EncryptedPdfException extends EngineException {
        public EncryptedPdfException(String documentId) {
            super("Encrypted PDF \u2013 cannot render " + documentId);
        }
    }
}
