package dk.trustworks.documentassembly.exceptions;

/**
 * Thrown when a spreadsheet container does not exist at the given location.
 */
public class ContainerNotFoundException extends DocumentAssemblyException {

    public ContainerNotFoundException(String message) {
        super(message);
    }
}
