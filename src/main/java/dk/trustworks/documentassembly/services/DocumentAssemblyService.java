package dk.trustworks.documentassembly.services;

import dk.trustworks.documentassembly.converter.DocumentConverter;
import dk.trustworks.documentassembly.exceptions.DocumentAssemblyException;
import dk.trustworks.documentassembly.exceptions.TemplateNotFoundException;
import dk.trustworks.documentassembly.merge.PdfMergeOrchestrator;
import dk.trustworks.documentassembly.merge.model.PdfAttachment;
import dk.trustworks.documentassembly.process.ScopedTempDirectory;
import dk.trustworks.documentassembly.template.PlaceholderMap;
import dk.trustworks.documentassembly.template.TemplatePlaceholderExtractor;
import dk.trustworks.documentassembly.template.TemplateRewriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Produces a finished PDF from a word template: fill placeholders, convert, append attachments.
 *
 * <p>All intermediate files live in one work directory per call, removed on every exit path.
 * Either complete PDF bytes are returned or a {@link DocumentAssemblyException} subtype is thrown.
 */
@JBossLog
@ApplicationScoped
public class DocumentAssemblyService {

    @Inject
    TemplateRewriter templateRewriter;

    @Inject
    TemplatePlaceholderExtractor placeholderExtractor;

    @Inject
    DocumentConverter documentConverter;

    @Inject
    PdfMergeOrchestrator mergeOrchestrator;

    /**
     * Generates the final PDF.
     *
     * @param template    path of the .docx template
     * @param values      placeholder values
     * @param attachments PDFs appended after the generated document, in order
     * @return PDF bytes suitable for an {@code application/pdf} response
     */
    public byte[] generatePdf(Path template, PlaceholderMap values, List<PdfAttachment> attachments) {
        byte[] templateBytes = readTemplate(template);
        warnAboutUnfilled(template, templateBytes, values);

        log.infof("Generating PDF from %s (%d placeholder values, %d attachments)",
                template.getFileName(), values.size(), attachments != null ? attachments.size() : 0);

        try (ScopedTempDirectory workDir = ScopedTempDirectory.create("document-assembly-")) {
            Path filled = workDir.resolve("filled.docx");
            Files.write(filled, templateRewriter.rewrite(templateBytes, values));

            Path pdfDir = Files.createDirectory(workDir.resolve("pdf"));
            Path pdf = documentConverter.convertToPdf(filled, pdfDir);

            byte[] result = mergeOrchestrator.merge(pdf, attachments);
            log.infof("Generated PDF from %s: %d bytes", template.getFileName(), result.length);
            return result;
        } catch (IOException e) {
            log.errorf(e, "Document generation failed: %s", e.getMessage());
            throw new DocumentAssemblyException("Document generation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fills a template without converting it.
     *
     * @return bytes of the filled .docx package
     */
    public byte[] fillTemplate(Path template, PlaceholderMap values) {
        return templateRewriter.rewrite(readTemplate(template), values);
    }

    private void warnAboutUnfilled(Path template, byte[] templateBytes, PlaceholderMap values) {
        Set<String> unfilled = placeholderExtractor.findUnfilled(templateBytes, values);
        if (!unfilled.isEmpty()) {
            log.warnf("Template %s has %d placeholder(s) without a value, left as is: %s",
                    template.getFileName(), unfilled.size(), unfilled);
        }
    }

    private static byte[] readTemplate(Path template) {
        if (!Files.isRegularFile(template)) {
            throw new TemplateNotFoundException("Template not found: " + template.getFileName());
        }
        try {
            return Files.readAllBytes(template);
        } catch (IOException e) {
            throw new DocumentAssemblyException("Failed to read template " + template.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
