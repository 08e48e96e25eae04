package dk.trustworks.documentassembly.merge.model;

import org.apache.commons.io.function.IOSupplier;

import java.util.Objects;

/**
 * A caller-supplied PDF to append after the generated document.
 * Content is read lazily, when the orchestrator validates it.
 *
 * @param filename name reported when the attachment is rejected
 * @param content  supplier of the attachment bytes
 */
public record PdfAttachment(String filename, IOSupplier<byte[]> content) {

    public PdfAttachment {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(content, "content");
    }

    public static PdfAttachment ofBytes(String filename, byte[] bytes) {
        byte[] copy = bytes != null ? bytes.clone() : new byte[0];
        return new PdfAttachment(filename, () -> copy);
    }
}
