package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.config.DocumentAssemblyConfig;
import dk.trustworks.documentassembly.merge.model.MergeTool;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary strategy: node runs a small pdf-lib script that copies every page of every input
 * into a new document. Needs both a node binary and a directory holding the pdf-lib package.
 *
 * <p>The script is {@code document-assembly.merge.node.script-path} when configured, otherwise the
 * bundled {@value #BUNDLED_SCRIPT} copied into the request's work directory.
 */
@JBossLog
@ApplicationScoped
public class NodePdfLibMergeStrategy extends ProcessMergeStrategy {

    static final String BUNDLED_SCRIPT = "merge-pdf.js";
    static final String LIBRARY_NAME = "pdf-lib";

    @Override
    public MergeTool tool() {
        return MergeTool.PDF_LIB;
    }

    @Override
    protected DocumentAssemblyConfig.Binary binary() {
        return config.merge().node().binary();
    }

    @Override
    protected List<String> arguments(List<Path> inputs, Path output, Path workDir) throws PdfMergeStrategyException {
        List<String> args = new ArrayList<>();
        args.add(script(workDir).toAbsolutePath().toString());
        args.add(output.toAbsolutePath().toString());
        args.addAll(absolute(inputs));
        return args;
    }

    @Override
    protected Map<String, String> environment(Path workDir) throws PdfMergeStrategyException {
        return Map.of("NODE_PATH", modulesDirectory().toAbsolutePath().toString());
    }

    private Path script(Path workDir) throws PdfMergeStrategyException {
        Optional<String> configured = config.merge().node().scriptPath().filter(s -> !s.isBlank());
        if (configured.isPresent()) {
            Path path = Path.of(configured.get().trim());
            if (!Files.isRegularFile(path)) {
                throw new PdfMergeStrategyException("merge script not found at " + path);
            }
            return path;
        }

        Path target = workDir.resolve(BUNDLED_SCRIPT);
        try (InputStream in = NodePdfLibMergeStrategy.class.getClassLoader().getResourceAsStream(BUNDLED_SCRIPT)) {
            if (in == null) {
                throw new PdfMergeStrategyException("bundled " + BUNDLED_SCRIPT + " is missing from the classpath");
            }
            Files.copy(in, target);
        } catch (IOException e) {
            throw new PdfMergeStrategyException("failed to write merge script: " + e.getMessage(), e);
        }
        return target;
    }

    /**
     * Finds the directory that contains the pdf-lib package: the configured modules path, or the
     * first entry of the modules environment variable that has it.
     */
    Path modulesDirectory() throws PdfMergeStrategyException {
        DocumentAssemblyConfig.Node node = config.merge().node();
        Optional<String> configured = node.modulesPath().filter(s -> !s.isBlank());
        if (configured.isPresent()) {
            Path dir = Path.of(configured.get().trim());
            if (!containsLibrary(dir)) {
                throw new PdfMergeStrategyException(LIBRARY_NAME + " dependency not found in " + dir);
            }
            return dir;
        }

        String fromEnv = binaryResolver.getenv(node.modulesEnv());
        if (fromEnv != null) {
            for (String entry : fromEnv.split(File.pathSeparator)) {
                if (entry.isBlank()) {
                    continue;
                }
                try {
                    Path dir = Path.of(entry.trim());
                    if (containsLibrary(dir)) {
                        return dir;
                    }
                } catch (InvalidPathException e) {
                    log.debugf("Ignoring invalid %s entry: %s", node.modulesEnv(), entry);
                }
            }
        }
        throw new PdfMergeStrategyException(LIBRARY_NAME + " dependency not found (configure "
                + "document-assembly.merge.node.modules-path or set " + node.modulesEnv() + ")");
    }

    private static boolean containsLibrary(Path dir) {
        return Files.isDirectory(dir.resolve(LIBRARY_NAME));
    }
}
