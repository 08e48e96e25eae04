package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.exceptions.DocumentAssemblyException;
import dk.trustworks.documentassembly.exceptions.InvalidAttachmentException;
import dk.trustworks.documentassembly.exceptions.MergeStrategyExhaustedException;
import dk.trustworks.documentassembly.merge.model.MergeFailure;
import dk.trustworks.documentassembly.merge.model.PdfAttachment;
import dk.trustworks.documentassembly.process.ScopedTempDirectory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends caller-supplied PDF attachments to a generated base PDF.
 *
 * <p>Attachments are validated before any work directory is created. The merge itself is
 * delegated to external tools, tried in a fixed order until one succeeds:
 * pdf-lib (node), ghostscript, pdfunite.
 */
@JBossLog
@ApplicationScoped
public class PdfMergeOrchestrator {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final List<PdfMergeStrategy> strategies;

    @Inject
    public PdfMergeOrchestrator(NodePdfLibMergeStrategy pdfLib,
                                GhostscriptMergeStrategy ghostscript,
                                PdfuniteMergeStrategy pdfunite) {
        this(List.of(pdfLib, ghostscript, pdfunite));
    }

    PdfMergeOrchestrator(List<PdfMergeStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Merges the base PDF with the attachments, in submission order.
     *
     * @param basePdf     the generated document, always first in the result
     * @param attachments PDFs to append; empty or whitespace-only ones are skipped
     * @return merged PDF bytes, or the base bytes unchanged when nothing is appended
     * @throws InvalidAttachmentException      if an attachment is unreadable or not a PDF
     * @throws MergeStrategyExhaustedException if no strategy could merge the files
     */
    public byte[] merge(Path basePdf, List<PdfAttachment> attachments) {
        List<ValidatedAttachment> usable = validate(attachments != null ? attachments : List.of());

        byte[] baseBytes = readBase(basePdf);
        if (usable.isEmpty()) {
            log.debugf("No usable attachments, returning base PDF unchanged (%d bytes)", baseBytes.length);
            return baseBytes;
        }

        log.infof("Merging base PDF with %d attachment(s)", usable.size());
        try (ScopedTempDirectory workDir = ScopedTempDirectory.create("pdf-merge-")) {
            List<Path> inputs = new ArrayList<>();
            Path base = workDir.resolve("base.pdf");
            Files.write(base, baseBytes);
            inputs.add(base);
            for (ValidatedAttachment attachment : usable) {
                Path file = workDir.resolve("attachment-" + attachment.position() + ".pdf");
                Files.write(file, attachment.bytes());
                inputs.add(file);
            }

            Path output = workDir.resolve("merged.pdf");
            List<MergeFailure> failures = new ArrayList<>();
            for (PdfMergeStrategy strategy : strategies) {
                try {
                    Files.deleteIfExists(output);
                    strategy.merge(inputs, output, workDir.path());
                    byte[] merged = Files.readAllBytes(output);
                    log.infof("Merged %d PDF file(s) with %s -> %d bytes",
                            inputs.size(), strategy.tool().getDisplayName(), merged.length);
                    return merged;
                } catch (PdfMergeStrategyException e) {
                    MergeFailure failure = new MergeFailure(strategy.tool(), workDir.redact(e.getMessage()));
                    log.warnf("PDF merge strategy failed: %s", failure);
                    failures.add(failure);
                } catch (IOException | RuntimeException e) {
                    MergeFailure failure = new MergeFailure(strategy.tool(), workDir.redact(describe(e)));
                    log.warnf(e, "PDF merge strategy failed unexpectedly: %s", failure);
                    failures.add(failure);
                }
            }
            throw new MergeStrategyExhaustedException(failures);
        } catch (IOException e) {
            log.errorf(e, "PDF merge failed: %s", e.getMessage());
            throw new DocumentAssemblyException("Failed to prepare PDF merge: " + e.getMessage(), e);
        }
    }

    private List<ValidatedAttachment> validate(List<PdfAttachment> attachments) {
        List<ValidatedAttachment> usable = new ArrayList<>();
        for (int i = 0; i < attachments.size(); i++) {
            PdfAttachment attachment = attachments.get(i);
            byte[] bytes;
            try {
                bytes = attachment.content().get();
            } catch (IOException e) {
                throw new InvalidAttachmentException(attachment.filename(),
                        "Failed to read attachment " + attachment.filename() + ": " + e.getMessage(), e);
            }

            if (bytes == null || isBlank(bytes)) {
                log.debugf("Skipping empty attachment %s", attachment.filename());
                continue;
            }
            if (!startsWithPdfSignature(bytes)) {
                throw new InvalidAttachmentException(attachment.filename(),
                        "Attachment " + attachment.filename() + " is not a valid PDF file");
            }
            usable.add(new ValidatedAttachment(i + 1, bytes));
        }
        return usable;
    }

    private static byte[] readBase(Path basePdf) {
        try {
            return Files.readAllBytes(basePdf);
        } catch (IOException e) {
            throw new DocumentAssemblyException("Failed to read generated PDF: " + e.getMessage(), e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    static boolean isBlank(byte[] bytes) {
        for (byte b : bytes) {
            if (b != ' ' && b != '\t' && b != '\n' && b != '\r' && b != '\f' && b != 0x0B) {
                return false;
            }
        }
        return true;
    }

    static boolean startsWithPdfSignature(byte[] bytes) {
        if (bytes.length < PDF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < PDF_SIGNATURE.length; i++) {
            if (bytes[i] != PDF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    private record ValidatedAttachment(int position, byte[] bytes) {
    }
}
