package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.config.DocumentAssemblyConfig;
import dk.trustworks.documentassembly.process.BinaryNotFoundException;
import dk.trustworks.documentassembly.process.BinaryResolver;
import dk.trustworks.documentassembly.process.ProcessResult;
import dk.trustworks.documentassembly.process.ProcessRunner;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared flow of the subprocess-backed strategies: resolve the binary, run it with the
 * strategy's arguments, and accept the result only on exit code 0 with a non-empty output file.
 */
@JBossLog
public abstract class ProcessMergeStrategy implements PdfMergeStrategy {

    @Inject
    DocumentAssemblyConfig config;

    @Inject
    BinaryResolver binaryResolver;

    @Inject
    ProcessRunner processRunner;

    protected abstract DocumentAssemblyConfig.Binary binary();

    protected abstract List<String> arguments(List<Path> inputs, Path output, Path workDir)
            throws PdfMergeStrategyException;

    protected Map<String, String> environment(Path workDir) throws PdfMergeStrategyException {
        return Map.of();
    }

    @Override
    public void merge(List<Path> inputs, Path output, Path workDir) throws PdfMergeStrategyException {
        if (inputs.isEmpty()) {
            throw new PdfMergeStrategyException("no pdf files provided for merging");
        }

        Path executable;
        try {
            executable = binaryResolver.resolve(tool().getDisplayName(), binary());
        } catch (BinaryNotFoundException e) {
            throw new PdfMergeStrategyException(e.getMessage(), e);
        }

        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(arguments(inputs, output, workDir));
        Map<String, String> env = environment(workDir);

        int timeoutSeconds = config.merge().timeoutSeconds();
        ProcessResult result;
        try {
            result = processRunner.run(command, workDir, env, Duration.ofSeconds(timeoutSeconds));
        } catch (IOException e) {
            throw new PdfMergeStrategyException("failed to start " + executable.getFileName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PdfMergeStrategyException("interrupted while waiting for " + executable.getFileName(), e);
        }

        if (result.timedOut()) {
            throw new PdfMergeStrategyException("timed out after " + timeoutSeconds + " seconds");
        }
        if (result.exitCode() != 0) {
            throw new PdfMergeStrategyException(result.diagnostic());
        }
        if (!hasContent(output)) {
            throw new PdfMergeStrategyException("exited successfully but wrote no output");
        }
        log.debugf("%s merged %d file(s)", tool().getDisplayName(), inputs.size());
    }

    private static boolean hasContent(Path file) {
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    protected static List<String> absolute(List<Path> paths) {
        List<String> result = new ArrayList<>(paths.size());
        for (Path path : paths) {
            result.add(path.toAbsolutePath().toString());
        }
        return result;
    }
}
