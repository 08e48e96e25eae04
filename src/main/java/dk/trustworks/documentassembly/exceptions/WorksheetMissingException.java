package dk.trustworks.documentassembly.exceptions;

/**
 * Thrown when a workbook package contains no worksheet part.
 */
public class WorksheetMissingException extends DocumentAssemblyException {

    public WorksheetMissingException(String message) {
        super(message);
    }
}
