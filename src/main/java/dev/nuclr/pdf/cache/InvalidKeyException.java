package dev.nuclr.pdf.cache;

/**
 * A page key or request argument is malformed. Raised before any I/O happens.
 */
public class InvalidKeyException extends IllegalArgumentException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
