package dk.trustworks.documentassembly.exceptions;

/**
 * Thrown when a caller-supplied attachment cannot be read or is not a PDF.
 */
public class InvalidAttachmentException extends DocumentAssemblyException {

    private final String attachmentName;

    public InvalidAttachmentException(String attachmentName, String message) {
        super(message);
        this.attachmentName = attachmentName;
    }

    public InvalidAttachmentException(String attachmentName, String message, Throwable cause) {
        super(message, cause);
        this.attachmentName = attachmentName;
    }

    public String getAttachmentName() {
        return attachmentName;
    }
}
