package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.config.DocumentAssemblyConfig;
import dk.trustworks.documentassembly.merge.model.MergeTool;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Second strategy: ghostscript's pdfwrite device re-renders all inputs into one file.
 */
@ApplicationScoped
public class GhostscriptMergeStrategy extends ProcessMergeStrategy {

    @Override
    public MergeTool tool() {
        return MergeTool.GHOSTSCRIPT;
    }

    @Override
    protected DocumentAssemblyConfig.Binary binary() {
        return config.merge().ghostscript().binary();
    }

    @Override
    protected List<String> arguments(List<Path> inputs, Path output, Path workDir) {
        List<String> args = new ArrayList<>(List.of(
                "-q", "-dNOPAUSE", "-dBATCH", "-sDEVICE=pdfwrite",
                "-sOutputFile=" + output.toAbsolutePath()));
        args.addAll(absolute(inputs));
        return args;
    }
}
