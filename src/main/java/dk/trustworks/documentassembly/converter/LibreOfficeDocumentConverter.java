package dk.trustworks.documentassembly.converter;

import dk.trustworks.documentassembly.config.DocumentAssemblyConfig;
import dk.trustworks.documentassembly.exceptions.ConversionFailedException;
import dk.trustworks.documentassembly.process.BinaryNotFoundException;
import dk.trustworks.documentassembly.process.BinaryResolver;
import dk.trustworks.documentassembly.process.ProcessResult;
import dk.trustworks.documentassembly.process.ProcessRunner;
import dk.trustworks.documentassembly.process.ScopedTempDirectory;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Converts filled templates to PDF with LibreOffice in headless mode.
 *
 * <p>This converter:
 * <ul>
 *   <li>Resolves the binary on every call ({@code LIBREOFFICE}, configured path, then soffice/libreoffice on PATH)</li>
 *   <li>Limits concurrent conversions via semaphore (LibreOffice is memory-intensive)</li>
 *   <li>Optionally gives each call its own throw-away user profile</li>
 *   <li>Only trusts the conversion when the expected PDF actually exists</li>
 * </ul>
 */
@JBossLog
@ApplicationScoped
public class LibreOfficeDocumentConverter implements DocumentConverter {

    @Inject
    DocumentAssemblyConfig config;

    @Inject
    BinaryResolver binaryResolver;

    @Inject
    ProcessRunner processRunner;

    private Semaphore conversionSemaphore;

    @PostConstruct
    void init() {
        conversionSemaphore = new Semaphore(Math.max(1, config.converter().maxConcurrent()));
        log.infof("LibreOfficeDocumentConverter initialized: maxConcurrent=%d, timeout=%ds, isolatedProfile=%s",
                config.converter().maxConcurrent(),
                config.converter().timeoutSeconds(),
                config.converter().isolatedProfile());
    }

    @Override
    public Path convertToPdf(Path filledTemplate, Path outputDirectory) {
        if (!Files.isRegularFile(filledTemplate)) {
            throw new ConversionFailedException("Filled template not found: " + filledTemplate.getFileName());
        }

        Path soffice;
        try {
            soffice = binaryResolver.resolve("libreoffice", config.converter().binary());
        } catch (BinaryNotFoundException e) {
            throw new ConversionFailedException(e.getMessage() + ". Install LibreOffice or set "
                    + config.converter().binary().overrideEnv());
        }

        int timeoutSeconds = config.converter().timeoutSeconds();
        boolean acquired = false;
        try {
            acquired = conversionSemaphore.tryAcquire(timeoutSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ConversionFailedException(
                        "Conversion queue full (max " + config.converter().maxConcurrent() + " concurrent). Try again later.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionFailedException("Conversion interrupted while waiting for permit", e);
        }

        try {
            Path expectedPdf = outputDirectory.resolve(pdfFileName(filledTemplate));
            Files.deleteIfExists(expectedPdf);

            ProcessResult result;
            if (config.converter().isolatedProfile()) {
                try (ScopedTempDirectory profile = ScopedTempDirectory.create("libreoffice-profile-")) {
                    result = redacted(run(soffice, filledTemplate, outputDirectory, profile.path(), timeoutSeconds),
                            filledTemplate, outputDirectory, profile.path());
                }
            } else {
                result = redacted(run(soffice, filledTemplate, outputDirectory, null, timeoutSeconds),
                        filledTemplate, outputDirectory, null);
            }

            if (result.timedOut()) {
                throw new ConversionFailedException(
                        "LibreOffice conversion timed out after " + timeoutSeconds + " seconds",
                        result.stdout(), result.stderr());
            }
            if (result.exitCode() != 0) {
                log.errorf("LibreOffice failed with exit code %d. Output: %s", result.exitCode(), result.diagnostic());
                throw new ConversionFailedException(
                        "LibreOffice conversion failed with exit code: " + result.exitCode(),
                        result.stdout(), result.stderr());
            }
            if (!Files.isRegularFile(expectedPdf)) {
                log.errorf("PDF not found after conversion: %s", expectedPdf.getFileName());
                throw new ConversionFailedException(
                        "PDF not generated - LibreOffice may have failed silently",
                        result.stdout(), result.stderr());
            }

            log.infof("Converted %s to PDF (%d bytes)", filledTemplate.getFileName(), Files.size(expectedPdf));
            return expectedPdf;

        } catch (IOException e) {
            String reason = ScopedTempDirectory.redact(e.getMessage(), filledTemplate.getParent(), outputDirectory);
            log.errorf("Template-to-PDF conversion failed: %s", reason);
            throw new ConversionFailedException("LibreOffice conversion failed: " + reason, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionFailedException("LibreOffice conversion interrupted", e);
        } finally {
            conversionSemaphore.release();
        }
    }

    private ProcessResult run(Path soffice, Path template, Path outputDirectory, Path profileDir, int timeoutSeconds)
            throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(soffice.toString());
        if (profileDir != null) {
            command.add("-env:UserInstallation=" + profileDir.toUri());
        }
        command.addAll(List.of(
                "--headless", "--nologo", "--nodefault", "--nolockcheck", "--norestore",
                "--convert-to", "pdf",
                "--outdir", outputDirectory.toAbsolutePath().toString(),
                template.toAbsolutePath().toString()));

        log.debugf("Converting %s using %s", template.getFileName(), soffice);
        return processRunner.run(command, outputDirectory, Map.of(), Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * Masks the request's directories in captured output so failures never reveal server paths.
     */
    private static ProcessResult redacted(ProcessResult result, Path template, Path outputDirectory, Path profileDir) {
        Path[] directories = {template.getParent(), outputDirectory, profileDir};
        return new ProcessResult(result.exitCode(),
                ScopedTempDirectory.redact(result.stdout(), directories),
                ScopedTempDirectory.redact(result.stderr(), directories),
                result.timedOut());
    }

    static String pdfFileName(Path template) {
        String name = template.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + ".pdf";
    }
}
