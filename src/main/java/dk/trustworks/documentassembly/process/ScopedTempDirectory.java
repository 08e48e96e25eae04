package dk.trustworks.documentassembly.process;

import lombok.extern.jbosslog.JBossLog;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * A request-scoped temp directory, removed recursively when closed.
 * Use with try-with-resources so every exit path releases it.
 */
@JBossLog
public final class ScopedTempDirectory implements AutoCloseable {

    private static final String REDACTED = "<work-dir>";

    private final Path path;

    private ScopedTempDirectory(Path path) {
        this.path = path;
    }

    /**
     * Creates a unique temp directory whose name starts with the given prefix.
     */
    public static ScopedTempDirectory create(String prefix) throws IOException {
        Path dir = Files.createTempDirectory(prefix + UUID.randomUUID().toString().substring(0, 8) + "-");
        log.debugf("Created temp directory: %s", dir);
        return new ScopedTempDirectory(dir);
    }

    public Path path() {
        return path;
    }

    public Path resolve(String name) {
        return path.resolve(name);
    }

    /**
     * Replaces this directory's absolute location in tool output with a neutral marker.
     */
    public String redact(String text) {
        return redact(text, path);
    }

    /**
     * Replaces the absolute location of each given directory in {@code text} with a neutral marker.
     * Longer locations are replaced first so a nested directory never leaves part of its path behind.
     */
    public static String redact(String text, Path... directories) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        List<String> locations = new ArrayList<>();
        for (Path directory : directories) {
            if (directory != null) {
                locations.add(directory.toAbsolutePath().normalize().toString());
            }
        }
        locations.sort(Comparator.comparingInt(String::length).reversed());
        String result = text;
        for (String location : locations) {
            if (location.length() > 1) {
                result = result.replace(location, REDACTED);
            }
        }
        return result;
    }

    @Override
    public void close() {
        try {
            FileUtils.deleteDirectory(path.toFile());
            log.debugf("Cleaned up temp directory: %s", path);
        } catch (IOException e) {
            log.warnf("Failed to cleanup temp directory %s: %s", path, e.getMessage());
        }
    }
}
