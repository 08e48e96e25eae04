package dk.trustworks.documentassembly.spreadsheet;

import dk.trustworks.documentassembly.exceptions.ContainerNotFoundException;
import dk.trustworks.documentassembly.exceptions.MalformedContainerException;
import dk.trustworks.documentassembly.exceptions.WorksheetMissingException;
import dk.trustworks.documentassembly.spreadsheet.model.TabularRow;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.xssf.eventusermodel.ReadOnlySharedStringsTable;
import org.apache.poi.xssf.eventusermodel.XSSFReader;
import org.xml.sax.SAXException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Streams the first worksheet of an .xlsx workbook as rows of strings.
 *
 * <p>Every cell is read as text: shared strings are resolved, inline strings are concatenated,
 * and anything else (numbers, dates, booleans, formula results) is returned as the raw cell
 * value. Further worksheets and merged ranges are ignored.
 */
@JBossLog
@ApplicationScoped
public class SpreadsheetRowReader {

    /**
     * Reads all rows of the first worksheet.
     *
     * @throws ContainerNotFoundException  if the file does not exist
     * @throws WorksheetMissingException   if the workbook has no worksheet
     * @throws MalformedContainerException if the file is not a readable workbook
     */
    public List<TabularRow> readRows(Path workbook) {
        if (!Files.isRegularFile(workbook)) {
            throw new ContainerNotFoundException("Spreadsheet not found: " + workbook.getFileName());
        }

        OPCPackage pkg = null;
        try {
            pkg = OPCPackage.open(workbook.toFile(), PackageAccess.READ);
            XSSFReader reader = new XSSFReader(pkg);
            List<String> sharedStrings = readSharedStrings(pkg);

            Iterator<InputStream> sheets = reader.getSheetsData();
            if (!sheets.hasNext()) {
                throw new WorksheetMissingException("Workbook " + workbook.getFileName() + " contains no worksheet");
            }
            try (InputStream sheet = sheets.next()) {
                List<TabularRow> rows = parseSheet(sheet, sharedStrings);
                log.debugf("Read %d rows from %s (%d shared strings)",
                        (Object) rows.size(), workbook.getFileName(), (Object) sharedStrings.size());
                return rows;
            }
        } catch (UnsupportedFileFormatException | EmptyFileException | POIXMLException | OpenXML4JRuntimeException e) {
            throw new MalformedContainerException("Not a valid workbook: " + workbook.getFileName(), e);
        } catch (OpenXML4JException | IOException e) {
            throw new MalformedContainerException("Failed to open workbook " + workbook.getFileName() + ": " + e.getMessage(), e);
        } catch (XMLStreamException e) {
            throw new MalformedContainerException("Malformed worksheet in " + workbook.getFileName() + ": " + e.getMessage(), e);
        } finally {
            if (pkg != null) {
                // read-only packages are released with revert(), close() would try to save
                pkg.revert();
            }
        }
    }

    /**
     * Reads the first worksheet as a header row plus data rows.
     */
    public SpreadsheetTable readTable(Path workbook) {
        return SpreadsheetTable.of(readRows(workbook));
    }

    private List<String> readSharedStrings(OPCPackage pkg) {
        try {
            ReadOnlySharedStringsTable table = new ReadOnlySharedStringsTable(pkg);
            List<String> strings = new ArrayList<>(table.getUniqueCount());
            for (int i = 0; i < table.getUniqueCount(); i++) {
                strings.add(table.getItemAt(i).getString());
            }
            return strings;
        } catch (IOException | SAXException | RuntimeException e) {
            log.warnf("Ignoring unreadable shared string table: %s", e.getMessage());
            return List.of();
        }
    }

    List<TabularRow> parseSheet(InputStream sheet, List<String> sharedStrings) throws XMLStreamException {
        XMLInputFactory factory = XMLInputFactory.newDefaultFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        XMLStreamReader xml = factory.createXMLStreamReader(sheet);

        List<TabularRow> rows = new ArrayList<>();
        try {
            List<String> row = null;
            int maxColumn = 0;
            int lastColumn = 0;
            int column = 0;
            String cellType = null;
            StringBuilder value = new StringBuilder();
            boolean inValue = false;
            boolean inInline = false;
            boolean inInlineText = false;
            boolean inPhonetic = false;

            while (xml.hasNext()) {
                int event = xml.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    switch (xml.getLocalName()) {
                        case "row" -> {
                            row = new ArrayList<>();
                            maxColumn = 0;
                            lastColumn = 0;
                        }
                        case "c" -> {
                            column = SpreadsheetColumns.columnIndex(xml.getAttributeValue(null, "r"));
                            if (column <= 0) {
                                column = lastColumn + 1;
                            }
                            cellType = xml.getAttributeValue(null, "t");
                            value.setLength(0);
                        }
                        case "v" -> inValue = true;
                        case "is" -> inInline = true;
                        case "rPh" -> inPhonetic = true;
                        case "t" -> inInlineText = inInline && !inPhonetic;
                        default -> {
                        }
                    }
                } else if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA
                        || event == XMLStreamConstants.SPACE) {
                    if (inValue || inInlineText) {
                        value.append(xml.getText());
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT) {
                    switch (xml.getLocalName()) {
                        case "v" -> inValue = false;
                        case "t" -> inInlineText = false;
                        case "is" -> inInline = false;
                        case "rPh" -> inPhonetic = false;
                        case "c" -> {
                            if (row != null) {
                                put(row, column, resolve(cellType, value.toString(), sharedStrings));
                                lastColumn = column;
                                maxColumn = Math.max(maxColumn, column);
                            }
                        }
                        case "row" -> {
                            if (row != null) {
                                pad(row, maxColumn);
                                rows.add(new TabularRow(row));
                                row = null;
                            }
                        }
                        default -> {
                        }
                    }
                }
            }
        } finally {
            xml.close();
        }
        return rows;
    }

    private static String resolve(String cellType, String raw, List<String> sharedStrings) {
        if ("s".equals(cellType)) {
            try {
                int index = Integer.parseInt(raw.trim());
                if (index >= 0 && index < sharedStrings.size()) {
                    return sharedStrings.get(index);
                }
            } catch (NumberFormatException e) {
                log.debugf("Shared string index is not a number: %s", raw);
            }
        }
        return raw;
    }

    private static void put(List<String> row, int column, String value) {
        pad(row, column - 1);
        if (row.size() >= column) {
            row.set(column - 1, value);
        } else {
            row.add(value);
        }
    }

    private static void pad(List<String> row, int size) {
        while (row.size() < size) {
            row.add("");
        }
    }
}
