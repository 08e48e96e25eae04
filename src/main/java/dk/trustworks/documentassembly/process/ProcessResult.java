package dk.trustworks.documentassembly.process;

/**
 * Outcome of one finished (or killed) subprocess.
 *
 * @param exitCode exit code, or -1 when the process was killed on timeout
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param timedOut whether the deadline expired before the process exited
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Best single-line explanation of a failure: stderr, else stdout, else the exit code.
     */
    public String diagnostic() {
        if (timedOut) {
            return "timed out";
        }
        if (!stderr.isBlank()) {
            return stderr.strip();
        }
        if (!stdout.isBlank()) {
            return stdout.strip();
        }
        return "exit code " + exitCode;
    }
}
