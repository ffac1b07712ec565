package dev.nuclr.pdf.cache;

/**
 * Identity of one cached render. Two keys match only when every field is equal;
 * scales are compared exactly.
 */
public record PageKey(String documentId, int pageNumber, float scale, int rotation) {

    public PageKey {
        if (documentId == null || documentId.isBlank()) {
            throw new InvalidKeyException("documentId must not be blank");
        }
        if (pageNumber < 0) {
            throw new InvalidKeyException("pageNumber must be >= 0, was " + pageNumber);
        }
        if (!(scale > 0f) || Float.isInfinite(scale)) {
            throw new InvalidKeyException("scale must be a positive finite number, was " + scale);
        }
        if (rotation != 0 && rotation != 90 && rotation != 180 && rotation != 270) {
            throw new InvalidKeyException("rotation must be 0, 90, 180 or 270, was " + rotation);
        }
    }

    public static PageKey of(String documentId, int pageNumber, float scale) {
        return new PageKey(documentId, pageNumber, scale, 0);
    }

    public boolean belongsTo(String otherDocumentId) {
        return documentId.equals(otherDocumentId);
    }
}
