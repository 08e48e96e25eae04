package dk.trustworks.documentassembly.process;

/**
 * Thrown when an external tool cannot be located by any configured rule.
 */
public class BinaryNotFoundException extends Exception {

    public BinaryNotFoundException(String message) {
        super(message);
    }
}
