package dk.trustworks.documentassembly.process;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools as one-shot subprocesses with a deadline.
 *
 * <p>Standard output and standard error are redirected to temp files, not pipes, and are
 * truncated when read back.
 */
@JBossLog
@ApplicationScoped
public class ProcessRunner {

    private static final int MAX_CAPTURED_CHARS = 8_000;
    private static final long KILL_GRACE_SECONDS = 5;

    /**
     * Runs a command and waits for it, killing it when the timeout expires.
     *
     * @param command          binary followed by its arguments
     * @param workingDirectory directory to run in, or null for the current one
     * @param environment      variables added to the inherited environment
     * @param timeout          maximum time to wait for the process
     * @return exit status and captured output
     */
    public ProcessResult run(List<String> command, Path workingDirectory, Map<String, String> environment, Duration timeout)
            throws IOException, InterruptedException {
        Path stdoutFile = Files.createTempFile("process-", ".out");
        Path stderrFile = Files.createTempFile("process-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            pb.environment().putAll(environment);
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());

            log.debugf("Starting %s with %d argument(s), timeout %ds",
                    command.get(0), command.size() - 1, timeout.toSeconds());
            Process process = pb.start();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
                log.warnf("%s did not finish within %ds and was killed", command.get(0), timeout.toSeconds());
                return new ProcessResult(-1, read(stdoutFile), read(stderrFile), true);
            }

            return new ProcessResult(process.exitValue(), read(stdoutFile), read(stderrFile), false);
        } finally {
            delete(stdoutFile);
            delete(stderrFile);
        }
    }

    private static String read(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), Charset.defaultCharset());
        if (text.length() > MAX_CAPTURED_CHARS) {
            return text.substring(0, MAX_CAPTURED_CHARS) + "...";
        }
        return text;
    }

    private static void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warnf("Failed to delete process output file %s: %s", file, e.getMessage());
        }
    }
}
