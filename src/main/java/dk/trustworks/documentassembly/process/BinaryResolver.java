package dk.trustworks.documentassembly.process;

import dk.trustworks.documentassembly.config.DocumentAssemblyConfig;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Locates external binaries at call time.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>The override environment variable, when set</li>
 *   <li>The configured path, when present</li>
 *   <li>Each candidate name, looked up on PATH</li>
 * </ol>
 *
 * <p>An absolute override that is not executable fails immediately; a bare name that
 * cannot be found falls through to the next rule.
 */
@JBossLog
@ApplicationScoped
public class BinaryResolver {

    private final Function<String, String> environment;

    public BinaryResolver() {
        this(System::getenv);
    }

    /**
     * @param environment lookup used for override variables and PATH
     */
    public BinaryResolver(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Resolves the binary for one tool.
     *
     * @param toolName name used in diagnostics
     * @param binary   resolution rules for the tool
     * @return path of an executable file
     * @throws BinaryNotFoundException if no rule yields an executable
     */
    public Path resolve(String toolName, DocumentAssemblyConfig.Binary binary) throws BinaryNotFoundException {
        List<String> tried = new ArrayList<>();

        String overrideEnv = binary.overrideEnv();
        String override = trimToNull(overrideEnv != null ? environment.apply(overrideEnv) : null);
        if (override != null) {
            Optional<Path> resolved = resolveExplicit(toolName, override, "environment variable " + overrideEnv);
            if (resolved.isPresent()) {
                return resolved.get();
            }
            tried.add(override + " (" + overrideEnv + ")");
        }

        Optional<String> configured = binary.path().map(BinaryResolver::trimToNull);
        if (configured.isPresent()) {
            Optional<Path> resolved = resolveExplicit(toolName, configured.get(), "configured path");
            if (resolved.isPresent()) {
                return resolved.get();
            }
            tried.add(configured.get());
        }

        for (String candidate : binary.candidates()) {
            String name = trimToNull(candidate);
            if (name == null) {
                continue;
            }
            Optional<Path> resolved = lookup(name);
            if (resolved.isPresent()) {
                log.debugf("Resolved %s binary on PATH: %s", toolName, resolved.get());
                return resolved.get();
            }
            tried.add(name);
        }

        if (tried.isEmpty()) {
            throw new BinaryNotFoundException(toolName + " binary not configured");
        }
        throw new BinaryNotFoundException(toolName + " binary not found (tried " + String.join(", ", tried) + ")");
    }

    /**
     * Reads an environment variable through the same source the resolver uses.
     */
    public String getenv(String name) {
        return environment.apply(name);
    }

    private Optional<Path> resolveExplicit(String toolName, String value, String source) throws BinaryNotFoundException {
        Path path;
        try {
            path = Path.of(value);
        } catch (InvalidPathException e) {
            throw new BinaryNotFoundException(toolName + " binary from " + source + " is not a valid path: " + value);
        }
        if (path.isAbsolute()) {
            if (isExecutableFile(path)) {
                log.debugf("Using %s binary from %s: %s", toolName, source, path);
                return Optional.of(path);
            }
            throw new BinaryNotFoundException(
                    "configured " + toolName + " binary " + value + " (" + source + ") is not accessible");
        }
        Optional<Path> found = lookup(value);
        found.ifPresent(p -> log.debugf("Using %s binary from %s: %s", toolName, source, p));
        return found;
    }

    /**
     * Looks a binary up the way a shell would: names with a separator are taken as
     * relative paths, bare names are searched on PATH.
     */
    Optional<Path> lookup(String name) {
        if (name.contains("/") || name.contains(File.separator)) {
            try {
                Path path = Path.of(name).toAbsolutePath();
                return isExecutableFile(path) ? Optional.of(path) : Optional.empty();
            } catch (InvalidPathException e) {
                return Optional.empty();
            }
        }

        String searchPath = environment.apply("PATH");
        if (searchPath == null || searchPath.isBlank()) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                Path path = Path.of(dir, name);
                if (isExecutableFile(path)) {
                    return Optional.of(path);
                }
            } catch (InvalidPathException e) {
                log.debugf("Skipping invalid PATH entry: %s", dir);
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
