package dk.trustworks.documentassembly.converter;

import java.nio.file.Path;

/**
 * Turns a filled word template into a PDF.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link LibreOfficeDocumentConverter} - LibreOffice headless subprocess (default)</li>
 * </ul>
 */
public interface DocumentConverter {

    /**
     * Converts a template file to PDF.
     *
     * <p>The PDF is written to {@code outputDirectory} under the template's base name with a
     * {@code .pdf} extension, e.g. {@code filled.docx} becomes {@code filled.pdf}.
     *
     * @param filledTemplate  the template with placeholders already substituted
     * @param outputDirectory directory that receives the PDF
     * @return path of the generated PDF
     * @throws dk.trustworks.documentassembly.exceptions.ConversionFailedException if no PDF was produced
     */
    Path convertToPdf(Path filledTemplate, Path outputDirectory);
}
