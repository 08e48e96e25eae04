package dk.trustworks.documentassembly.exceptions;

/**
 * Base type for every failure the document assembly pipeline reports to its callers.
 * Callers typically translate any subtype into a single failure response.
 */
public class DocumentAssemblyException extends RuntimeException {

    public DocumentAssemblyException(String message) {
        super(message);
    }

    public DocumentAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
