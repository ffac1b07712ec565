package dev.nuclr.pdf.cache.engine;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/** Builds small PDFs in memory. */
public final class TestPdfs {

    private TestPdfs() {
    }

    /** Pages of {@code width x height} points, each with a filled box in its top-left corner. */
    public static byte[] pages(int count, float width, float height) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < count; i++) {
                PDPage page = new PDPage(new PDRectangle(width, height));
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.setNonStrokingColor(Color.BLACK);
                    content.addRect(0, height - 20, 20, 20);
                    content.fill();
                }
            }
            PDDocumentInformation info = new PDDocumentInformation();
            info.setTitle("Fixture");
            info.setAuthor("Render cache tests");
            document.setDocumentInformation(info);
            return toBytes(document);
        }
    }

    public static byte[] encrypted() throws IOException {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage(PDRectangle.A6));
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-secret", "user-secret",
                    new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            return toBytes(document);
        }
    }

    private static byte[] toBytes(PDDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }
}
