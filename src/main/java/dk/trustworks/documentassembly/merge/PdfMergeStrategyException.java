package dk.trustworks.documentassembly.merge;

/**
 * A single merge strategy could not produce output. Never leaves the merge package;
 * {@link PdfMergeOrchestrator} records it and moves on to the next strategy.
 */
public class PdfMergeStrategyException extends Exception {

    public PdfMergeStrategyException(String message) {
        super(message);
    }

    public PdfMergeStrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
