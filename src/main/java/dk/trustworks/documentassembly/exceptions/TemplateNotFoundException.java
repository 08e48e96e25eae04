package dk.trustworks.documentassembly.exceptions;

/**
 * Thrown when the word template to fill does not exist or is not a regular file.
 */
public class TemplateNotFoundException extends DocumentAssemblyException {

    public TemplateNotFoundException(String message) {
        super(message);
    }
}
