package dk.trustworks.documentassembly.template;

import dk.trustworks.documentassembly.exceptions.MalformedContainerException;
import dk.trustworks.documentassembly.exceptions.TemplateNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import static dk.trustworks.documentassembly.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TemplateRewriter Tests")
class TemplateRewriterTest {

    private static final String DOCUMENT = "word/document.xml";
    private static final String TOKEN = "{{total_amount}}";
    private static final String VALUE = "1,234.50 THB";

    private TemplateRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = new TemplateRewriter();
        rewriter.patternCache = new PlaceholderPatternCache();
    }

    // =========================================================================
    // Substitution
    // =========================================================================

    @Nested
    @DisplayName("Substitution")
    class SubstitutionTests {

        @Test
        @DisplayName("Token in a single run is replaced")
        void rewrite_singleRun() throws Exception {
            byte[] result = rewriter.rewrite(docx(paragraph("Total: " + TOKEN)), values("total_amount", VALUE));

            assertEquals(List.of(List.of("Total: " + VALUE)), paragraphTexts(result));
        }

        @Test
        @DisplayName("Token split by a spell-check marker is replaced in the first run")
        void rewrite_splitAcrossRuns() throws Exception {
            byte[] result = rewriter.rewrite(
                    docx(paragraph("Total: {{to", "tal_am", "ount}} incl. VAT")),
                    values("total_amount", VALUE));

            assertEquals(List.of(List.of("Total: " + VALUE, "", " incl. VAT")), paragraphTexts(result));
            String xml = entryText(result, DOCUMENT);
            assertTrue(xml.contains("w:proofErr"), "markup between runs is kept");
            assertTrue(xml.contains("<w:b/>") || xml.contains("<w:b></w:b>"), "run properties are kept");
        }

        @Test
        @DisplayName("Text after a split token stays in the bold run it was typed in")
        void rewrite_suffixKeepsClosingRunFormatting() throws Exception {
            byte[] result = rewriter.rewrite(docx(paragraph("{{to", "tal_amount}} is due")),
                    values("total_amount", VALUE));

            NodeList runs = parse(result).getElementsByTagNameNS(W_NS, "r");
            assertEquals(2, runs.getLength());
            Element plain = (Element) runs.item(0);
            Element bold = (Element) runs.item(1);
            assertEquals(0, plain.getElementsByTagNameNS(W_NS, "b").getLength());
            assertEquals(VALUE, plain.getElementsByTagNameNS(W_NS, "t").item(0).getTextContent());
            assertEquals(1, bold.getElementsByTagNameNS(W_NS, "b").getLength());
            assertEquals(" is due", bold.getElementsByTagNameNS(W_NS, "t").item(0).getTextContent());
        }

        @ParameterizedTest(name = "split points {0}")
        @MethodSource("dk.trustworks.documentassembly.template.TemplateRewriterTest#randomSplits")
        @DisplayName("Any split of a token into runs → value in the first run, the rest empty")
        void rewrite_arbitrarySplit(List<Integer> cuts) throws Exception {
            String[] runs = split(TOKEN, cuts);

            byte[] result = rewriter.rewrite(docx(paragraph(runs)), values("total_amount", VALUE));

            List<String> texts = paragraphTexts(result).get(0);
            assertEquals(runs.length, texts.size());
            assertEquals(VALUE, texts.get(0));
            for (int i = 1; i < texts.size(); i++) {
                assertEquals("", texts.get(i), "run " + i);
            }
        }

        @Test
        @DisplayName("Several tokens in one paragraph, some split")
        void rewrite_multipleTokens() throws Exception {
            byte[] result = rewriter.rewrite(
                    docx(paragraph("{{first}} and {{sec", "ond}}", " and {{first}}")),
                    values("first", "A", "second", "B"));

            assertEquals(List.of(List.of("A and B", "", " and A")), paragraphTexts(result));
        }

        @Test
        @DisplayName("Unknown tokens stay literally")
        void rewrite_unknownTokenKept() throws Exception {
            byte[] result = rewriter.rewrite(docx(paragraph("{{unknown}} / {{name}}")), values("name", "Alice"));

            assertEquals(List.of(List.of("{{unknown}} / Alice")), paragraphTexts(result));
        }

        @Test
        @DisplayName("Braced keys in the value map work like bare keys")
        void rewrite_bracedKey() throws Exception {
            byte[] result = rewriter.rewrite(docx(paragraph("{{name}}")), values("{{name}}", "Alice"));

            assertEquals(List.of(List.of("Alice")), paragraphTexts(result));
        }

        @Test
        @DisplayName("Values with XML special characters are escaped")
        void rewrite_escapesValue() throws Exception {
            byte[] result = rewriter.rewrite(docx(paragraph("{{client}}")), values("client", "Smith & Sons <Ltd>"));

            assertEquals(List.of(List.of("Smith & Sons <Ltd>")), paragraphTexts(result));
            assertTrue(entryText(result, DOCUMENT).contains("&amp;"));
        }

        @Test
        @DisplayName("Line breaks in a value become w:br elements")
        void rewrite_multilineValue() throws Exception {
            byte[] result = rewriter.rewrite(
                    docx(paragraph("{{address}}")),
                    values("address", "Street 1\r\nCity\nCountry"));

            Document document = parse(result);
            assertEquals(2, document.getElementsByTagNameNS(W_NS, "br").getLength());
            assertEquals(List.of(List.of("Street 1", "City", "Country")), paragraphTexts(result));
            Element run = (Element) document.getElementsByTagNameNS(W_NS, "r").item(0);
            assertEquals(List.of("t", "br", "t", "br", "t"), childNames(run));
        }

        @Test
        @DisplayName("Rewritten text elements preserve spaces")
        void rewrite_setsXmlSpacePreserve() throws Exception {
            byte[] result = rewriter.rewrite(docx(paragraph("{{name}}")), values("name", " padded "));

            Element text = (Element) parse(result).getElementsByTagNameNS(W_NS, "t").item(0);
            assertEquals("preserve", text.getAttributeNS(XMLConstants.XML_NS_URI, "space"));
            assertEquals(" padded ", text.getTextContent());
        }

        @Test
        @DisplayName("Tokens never join across paragraphs")
        void rewrite_noJoinAcrossParagraphs() throws Exception {
            byte[] template = docx(paragraph("{{na") + paragraph("me}}"));

            byte[] result = rewriter.rewrite(template, values("name", "Alice"));

            assertEquals(List.of(List.of("{{na"), List.of("me}}")), paragraphTexts(result));
        }

        @Test
        @DisplayName("Tokens in table cells are replaced")
        void rewrite_tableCells() throws Exception {
            byte[] template = docx(table(tableRow("{{a}}", "{{b}}"), tableRow("{{b}}", "x")));

            byte[] result = rewriter.rewrite(template, values("a", "1", "b", "2"));

            assertEquals(List.of(List.of("1"), List.of("2"), List.of("2"), List.of("x")), paragraphTexts(result));
        }

        @Test
        @DisplayName("Headers, footers and notes are rewritten")
        void rewrite_headerAndFooter() throws Exception {
            byte[] template = docx(Map.of(
                    DOCUMENT, documentXml(paragraph("body")),
                    "word/header1.xml", part("hdr", paragraph("{{company}}")),
                    "word/footer2.xml", part("ftr", paragraph("Page of {{com", "pany}}")),
                    "word/footnotes.xml", part("footnotes", paragraph("{{company}}"))));

            byte[] result = rewriter.rewrite(template, values("company", "Trustworks"));

            assertTrue(entryText(result, "word/header1.xml").contains(">Trustworks<"));
            assertTrue(entryText(result, "word/footer2.xml").contains("Page of Trustworks"));
            assertTrue(entryText(result, "word/footnotes.xml").contains(">Trustworks<"));
        }

        @Test
        @DisplayName("Rewritten parts keep their XML declaration")
        void rewrite_keepsDeclaration() {
            byte[] result = rewriter.rewrite(docx(paragraph("{{name}}")), values("name", "Alice"));

            assertTrue(entryText(result, DOCUMENT)
                    .startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"));
        }
    }

    // =========================================================================
    // Package handling
    // =========================================================================

    @Nested
    @DisplayName("Package handling")
    class PackageTests {

        @Test
        @DisplayName("Empty value map → every entry byte-identical, same order")
        void rewrite_emptyMap_isIdentity() {
            byte[] template = docx(paragraph("{{na", "me}}"));

            byte[] result = rewriter.rewrite(template, PlaceholderMap.empty());

            assertEntriesIdentical(unzip(template), unzip(result));
        }

        @Test
        @DisplayName("No matching token → parts byte-identical")
        void rewrite_noMatch_isIdentity() {
            byte[] template = docx(paragraph("Hello ", "world"));

            byte[] result = rewriter.rewrite(template, values("name", "Alice"));

            assertEntriesIdentical(unzip(template), unzip(result));
        }

        @Test
        @DisplayName("Parts other than body parts are copied even when they contain tokens")
        void rewrite_stylesUntouched() {
            byte[] template = docx(paragraph("{{name}}"));

            byte[] result = rewriter.rewrite(template, values("name", "Alice", "not_a_field", "X"));

            assertArrayEquals(unzip(template).get("word/styles.xml"), unzip(result).get("word/styles.xml"));
        }

        @Test
        @DisplayName("Unparseable part is copied unchanged, other parts still rewritten")
        void rewrite_malformedPart_failsSafe() {
            String broken = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><w:document xmlns:w=\"" + W_NS
                    + "\"><w:body><w:p><w:r><w:t>{{name}}</w:t></w:r>";
            byte[] template = docx(Map.of(
                    DOCUMENT, broken,
                    "word/footer1.xml", part("ftr", paragraph("{{name}}"))));

            byte[] result = rewriter.rewrite(template, values("name", "Alice"));

            assertArrayEquals(utf8(broken), unzip(result).get(DOCUMENT));
            assertTrue(entryText(result, "word/footer1.xml").contains(">Alice<"));
        }

        @Test
        @DisplayName("Markup inside a text element → part returned as the same array")
        void rewritePart_elementInsideText_returnsInput() {
            byte[] xml = utf8(documentXml("<w:p><w:r><w:t>{{name}}<w:b/></w:t></w:r></w:p>"));

            assertSame(xml, rewriter.rewritePart(DOCUMENT, xml, values("name", "Alice")));
        }

        @Test
        @DisplayName("Stored entries stay stored")
        void rewrite_storedEntryKeepsMethod() throws Exception {
            byte[] template = storedZip("word/document.xml", utf8(documentXml(paragraph("{{name}}"))));

            byte[] result = rewriter.rewrite(template, values("name", "Alice"));

            try (ZipInputStream zin = new ZipInputStream(new ByteArrayInputStream(result))) {
                ZipEntry entry = zin.getNextEntry();
                assertNotNull(entry);
                assertEquals(ZipEntry.STORED, entry.getMethod());
                assertTrue(new String(zin.readAllBytes(), StandardCharsets.UTF_8).contains(">Alice<"));
            }
        }

        @Test
        @DisplayName("Bytes that are not a zip package → MalformedContainerException")
        void rewrite_notAZip() {
            assertThrows(MalformedContainerException.class,
                    () -> rewriter.rewrite(utf8("just text"), values("name", "Alice")));
            assertThrows(MalformedContainerException.class,
                    () -> rewriter.rewrite(new byte[0], values("name", "Alice")));
        }

        @Test
        @DisplayName("File variant writes the filled package")
        void rewrite_files(@TempDir Path dir) throws Exception {
            Path template = dir.resolve("template.docx");
            Path output = dir.resolve("filled.docx");
            Files.write(template, docx(paragraph("{{name}}")));

            rewriter.rewrite(template, output, values("name", "Alice"));

            assertEquals(List.of(List.of("Alice")), paragraphTexts(Files.readAllBytes(output)));
        }

        @Test
        @DisplayName("Missing template file → TemplateNotFoundException")
        void rewrite_missingFile(@TempDir Path dir) {
            assertThrows(TemplateNotFoundException.class,
                    () -> rewriter.rewrite(dir.resolve("nope.docx"), dir.resolve("out.docx"), PlaceholderMap.empty()));
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static Stream<Arguments> randomSplits() {
        Random random = new Random(20240611L);
        List<Arguments> cases = new ArrayList<>();
        cases.add(Arguments.of(List.of()));
        cases.add(Arguments.of(IntStream.range(1, TOKEN.length()).boxed().toList()));
        cases.add(Arguments.of(List.of(1)));
        cases.add(Arguments.of(List.of(TOKEN.length() - 1)));
        for (int i = 0; i < 40; i++) {
            TreeSet<Integer> cuts = new TreeSet<>();
            int count = 1 + random.nextInt(6);
            while (cuts.size() < count) {
                cuts.add(1 + random.nextInt(TOKEN.length() - 1));
            }
            cases.add(Arguments.of(List.copyOf(cuts)));
        }
        return cases.stream();
    }

    private static String[] split(String text, List<Integer> cuts) {
        List<String> parts = new ArrayList<>();
        int previous = 0;
        for (int cut : cuts) {
            parts.add(text.substring(previous, cut));
            previous = cut;
        }
        parts.add(text.substring(previous));
        return parts.toArray(String[]::new);
    }

    private static PlaceholderMap values(String... keysAndValues) {
        Map<String, String> raw = new java.util.LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            raw.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return PlaceholderMap.of(raw);
    }

    private static String part(String root, String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                + "<w:" + root + " xmlns:w=\"" + W_NS + "\">" + body + "</w:" + root + ">";
    }

    private static Document parse(byte[] docx) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(unzip(docx).get(DOCUMENT)));
    }

    /**
     * Text of every text element, grouped by paragraph.
     */
    private static List<List<String>> paragraphTexts(byte[] docx) throws Exception {
        NodeList paragraphs = parse(docx).getElementsByTagNameNS(W_NS, "p");
        List<List<String>> result = new ArrayList<>();
        for (int i = 0; i < paragraphs.getLength(); i++) {
            NodeList texts = ((Element) paragraphs.item(i)).getElementsByTagNameNS(W_NS, "t");
            List<String> paragraph = new ArrayList<>();
            for (int j = 0; j < texts.getLength(); j++) {
                paragraph.add(texts.item(j).getTextContent());
            }
            result.add(paragraph);
        }
        return result;
    }

    private static List<String> childNames(Element element) {
        List<String> names = new ArrayList<>();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                names.add(child.getLocalName());
            }
        }
        return names;
    }

    private static void assertEntriesIdentical(Map<String, byte[]> expected, Map<String, byte[]> actual) {
        assertEquals(List.copyOf(expected.keySet()), List.copyOf(actual.keySet()));
        expected.forEach((name, bytes) -> assertArrayEquals(bytes, actual.get(name), name));
    }

    private static byte[] storedZip(String name, byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zout = new ZipOutputStream(out)) {
            CRC32 crc = new CRC32();
            crc.update(data);
            ZipEntry entry = new ZipEntry(name);
            entry.setMethod(ZipEntry.STORED);
            entry.setSize(data.length);
            entry.setCompressedSize(data.length);
            entry.setCrc(crc.getValue());
            zout.putNextEntry(entry);
            zout.write(data);
            zout.closeEntry();
        }
        return out.toByteArray();
    }
}
