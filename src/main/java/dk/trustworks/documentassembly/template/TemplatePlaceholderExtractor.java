package dk.trustworks.documentassembly.template;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the placeholder tokens a template contains.
 *
 * <p>Paragraph text is read through Apache POI, which joins the runs of a paragraph, so tokens
 * split across runs are found too. Scanned: body paragraphs, tables (including nested ones),
 * headers and footers.
 */
@JBossLog
@ApplicationScoped
public class TemplatePlaceholderExtractor {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([A-Za-z0-9_]+)\\}\\}");

    /**
     * Extracts all unique placeholder keys from a template.
     *
     * @param docxBytes the template as byte array
     * @return keys found, without braces, in order of first appearance; empty if the template
     *         cannot be read
     */
    public Set<String> extractPlaceholders(byte[] docxBytes) {
        if (docxBytes == null || docxBytes.length == 0) {
            log.debug("Empty template bytes provided, returning empty set");
            return Set.of();
        }

        Set<String> placeholders = new LinkedHashSet<>();
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(docxBytes))) {
            extractFromBody(document.getBodyElements(), placeholders);
            for (XWPFHeader header : document.getHeaderList()) {
                extractFromBody(header.getBodyElements(), placeholders);
            }
            for (XWPFFooter footer : document.getFooterList()) {
                extractFromBody(footer.getBodyElements(), placeholders);
            }
            log.debugf("Extracted %d placeholders from template", placeholders.size());
        } catch (IOException | RuntimeException e) {
            log.warnf("Failed to read template for placeholder extraction: %s", e.getMessage());
        }
        return Collections.unmodifiableSet(placeholders);
    }

    /**
     * Returns the template's placeholders that the given values do not cover, sorted.
     */
    public Set<String> findUnfilled(byte[] docxBytes, PlaceholderMap values) {
        Set<String> unfilled = new TreeSet<>();
        for (String key : extractPlaceholders(docxBytes)) {
            if (!values.contains(key)) {
                unfilled.add(key);
            }
        }
        return unfilled;
    }

    private void extractFromBody(List<IBodyElement> elements, Set<String> placeholders) {
        for (IBodyElement element : elements) {
            if (element instanceof XWPFParagraph paragraph) {
                extractFromText(paragraph.getText(), placeholders);
            } else if (element instanceof XWPFTable table) {
                extractFromTable(table, placeholders);
            }
        }
    }

    private void extractFromTable(XWPFTable table, Set<String> placeholders) {
        for (XWPFTableRow row : table.getRows()) {
            for (XWPFTableCell cell : row.getTableCells()) {
                extractFromBody(cell.getBodyElements(), placeholders);
            }
        }
    }

    private void extractFromText(String text, Set<String> placeholders) {
        if (text == null || text.isBlank()) {
            return;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        while (matcher.find()) {
            placeholders.add(matcher.group(1));
        }
    }
}
