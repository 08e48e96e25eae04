package dk.trustworks.documentassembly.exceptions;

/**
 * Exception thrown when the office converter fails to produce a PDF.
 * Carries whatever the converter printed so the cause can be diagnosed from logs.
 */
public class ConversionFailedException extends DocumentAssemblyException {

    private final String stdout;
    private final String stderr;

    public ConversionFailedException(String message) {
        this(message, "", "");
    }

    public ConversionFailedException(String message, String stdout, String stderr) {
        super(buildMessage(message, stdout, stderr));
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
    }

    public ConversionFailedException(String message, Throwable cause) {
        super(message, cause);
        this.stdout = "";
        this.stderr = "";
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    private static String buildMessage(String message, String stdout, String stderr) {
        StringBuilder sb = new StringBuilder(message);
        if (stdout != null && !stdout.isBlank()) {
            sb.append("; stdout: ").append(stdout.strip());
        }
        if (stderr != null && !stderr.isBlank()) {
            sb.append("; stderr: ").append(stderr.strip());
        }
        return sb.toString();
    }
}
