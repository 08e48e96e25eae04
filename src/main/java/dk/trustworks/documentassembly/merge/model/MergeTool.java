package dk.trustworks.documentassembly.merge.model;

/**
 * External PDF merge tools, in the order the orchestrator tries them.
 */
public enum MergeTool {

    PDF_LIB("pdf-lib"),
    GHOSTSCRIPT("ghostscript"),
    PDFUNITE("pdfunite");

    private final String displayName;

    MergeTool(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
