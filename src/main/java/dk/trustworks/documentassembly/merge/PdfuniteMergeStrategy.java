package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.config.DocumentAssemblyConfig;
import dk.trustworks.documentassembly.merge.model.MergeTool;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Path;
import java.util.List;

/**
 * Last resort: poppler's pdfunite, invoked as {@code pdfunite in1.pdf in2.pdf ... out.pdf}.
 */
@ApplicationScoped
public class PdfuniteMergeStrategy extends ProcessMergeStrategy {

    @Override
    public MergeTool tool() {
        return MergeTool.PDFUNITE;
    }

    @Override
    protected DocumentAssemblyConfig.Binary binary() {
        return config.merge().pdfunite().binary();
    }

    @Override
    protected List<String> arguments(List<Path> inputs, Path output, Path workDir) {
        List<String> args = absolute(inputs);
        args.add(output.toAbsolutePath().toString());
        return args;
    }
}
