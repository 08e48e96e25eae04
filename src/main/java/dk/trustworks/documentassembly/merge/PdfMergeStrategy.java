package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.merge.model.MergeTool;

import java.nio.file.Path;
import java.util.List;

/**
 * One external-tool recipe for concatenating PDF files.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link NodePdfLibMergeStrategy} - node running a pdf-lib script</li>
 *   <li>{@link GhostscriptMergeStrategy} - ghostscript pdfwrite device</li>
 *   <li>{@link PdfuniteMergeStrategy} - poppler's pdfunite</li>
 * </ul>
 */
public interface PdfMergeStrategy {

    MergeTool tool();

    /**
     * Merges the inputs, in order, into the output file.
     *
     * @param inputs  PDF files; the first one is the generated base document
     * @param output  file to create
     * @param workDir request-scoped directory the strategy may write helper files to
     * @throws PdfMergeStrategyException if the tool is unavailable, fails, or writes no output
     */
    void merge(List<Path> inputs, Path output, Path workDir) throws PdfMergeStrategyException;
}
