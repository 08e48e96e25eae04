package dk.trustworks.documentassembly.exceptions;

/**
 * Thrown when a zip-packaged container (workbook or word template) cannot be opened or read.
 */
public class MalformedContainerException extends DocumentAssemblyException {

    public MalformedContainerException(String message) {
        super(message);
    }

    public MalformedContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
