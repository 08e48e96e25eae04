package dk.trustworks.documentassembly.merge.model;

/**
 * Why one merge strategy did not produce a merged PDF.
 *
 * @param tool       the strategy's tool
 * @param diagnostic captured tool output or resolution error, with work-dir paths masked
 */
public record MergeFailure(MergeTool tool, String diagnostic) {

    @Override
    public String toString() {
        return tool.getDisplayName() + " (" + diagnostic + ")";
    }
}
