package dev.nuclr.pdf.cache;

/**
 * The rendering engine failed, was interrupted, or did not finish within the
 * configured timeout. Every caller coalesced onto the same render receives it.
 * The cache is left unchanged.
 */
public class RenderFailureException extends Exception {

    private final transient PageKey key;
    private final boolean timedOut;

    public RenderFailureException(PageKey key, String message, Throwable cause) {
        this(key, message, cause, false);
    }

    public RenderFailureException(PageKey key, String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.key = key;
        this.timedOut = timedOut;
    }

    public PageKey getKey() {
        return key;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
