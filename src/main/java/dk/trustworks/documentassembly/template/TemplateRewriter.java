package dk.trustworks.documentassembly.template;

import dk.trustworks.documentassembly.exceptions.DocumentAssemblyException;
import dk.trustworks.documentassembly.exceptions.MalformedContainerException;
import dk.trustworks.documentassembly.exceptions.TemplateNotFoundException;
import dk.trustworks.documentassembly.template.model.ContainerEntry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import javax.xml.stream.XMLEventFactory;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.StartDocument;
import javax.xml.stream.events.XMLEvent;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Fills {{placeholder}} tokens in a zip-packaged word-processing template.
 *
 * <p>This rewriter:
 * <ul>
 *   <li>Only touches body XML parts (document, headers, footers, foot- and endnotes)</li>
 *   <li>Copies every other entry byte for byte</li>
 *   <li>Finds tokens that Word split across several runs (spell-check marks, formatting changes)</li>
 *   <li>Emits line breaks in values as {@code w:br} elements</li>
 *   <li>Leaves a part untouched when it cannot be parsed, instead of failing the whole document</li>
 * </ul>
 */
@JBossLog
@ApplicationScoped
public class TemplateRewriter {

    @Inject
    PlaceholderPatternCache patternCache;

    /**
     * Reads a template file, fills it and writes the result.
     *
     * @throws TemplateNotFoundException    if the template file does not exist
     * @throws MalformedContainerException if the template is not a zip package
     */
    public void rewrite(Path template, Path output, PlaceholderMap values) {
        if (!Files.isRegularFile(template)) {
            throw new TemplateNotFoundException("Template not found: " + template.getFileName());
        }
        try {
            Files.write(output, rewrite(Files.readAllBytes(template), values));
        } catch (IOException e) {
            throw new DocumentAssemblyException("Failed to write filled template: " + e.getMessage(), e);
        }
    }

    /**
     * Fills a template held in memory.
     *
     * @param template bytes of the zip package
     * @param values   replacement values; unknown tokens in the template are left as they are
     * @return bytes of the rewritten zip package
     * @throws MalformedContainerException if the template is not a readable zip package
     */
    public byte[] rewrite(byte[] template, PlaceholderMap values) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(template.length);
        int entries = 0;
        int rewritten = 0;

        try (ZipInputStream zin = new ZipInputStream(new ByteArrayInputStream(template));
             ZipOutputStream zout = new ZipOutputStream(out)) {
            for (ZipEntry source; (source = zin.getNextEntry()) != null; ) {
                entries++;
                ContainerEntry entry = ContainerEntry.of(source.getName(), zin.readAllBytes());
                byte[] data = entry.transformable()
                        ? rewritePart(entry.name(), entry.bytes(), values)
                        : entry.bytes();
                if (data != entry.bytes()) {
                    rewritten++;
                }
                zout.putNextEntry(targetEntry(source, data));
                zout.write(data);
                zout.closeEntry();
            }
            if (entries == 0) {
                throw new MalformedContainerException("Template is not a zip package or has no entries");
            }
            zout.finish();
        } catch (ZipException e) {
            throw new MalformedContainerException("Template is not a valid zip package: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedContainerException("Failed to read template: " + e.getMessage(), e);
        }

        log.debugf("Template rewritten: %d entries, %d part(s) changed, %d placeholder value(s)",
                entries, rewritten, values.size());
        return out.toByteArray();
    }

    /**
     * Fills one XML part.
     *
     * @return the rewritten part, or the very same {@code xml} array when nothing was substituted
     *         or the part could not be parsed
     */
    public byte[] rewritePart(String partName, byte[] xml, PlaceholderMap values) {
        if (values.isEmpty()) {
            return xml;
        }
        try {
            byte[] rewritten = transform(xml, values);
            if (rewritten == null) {
                log.debugf("No placeholders substituted in %s", partName);
                return xml;
            }
            return rewritten;
        } catch (XmlPartUnparseableException e) {
            log.warnf("Leaving template part %s unchanged, it could not be rewritten: %s", partName, e.getMessage());
            return xml;
        }
    }

    private byte[] transform(byte[] xml, PlaceholderMap values) throws XmlPartUnparseableException {
        Map<String, Pattern> patterns = patternCache.patternsFor(values.keys());
        ByteArrayOutputStream out = new ByteArrayOutputStream(xml.length + 256);
        XMLEventReader reader = null;
        XMLEventWriter writer = null;
        try {
            reader = inputFactory().createXMLEventReader(new ByteArrayInputStream(xml));
            Writer sink = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writer = XMLOutputFactory.newDefaultFactory().createXMLEventWriter(sink);
            RunRewriter runs = new RunRewriter(writer, XMLEventFactory.newDefaultFactory(), patterns, values);

            while (reader.hasNext()) {
                XMLEvent event = reader.nextEvent();
                if (event.isStartDocument()) {
                    sink.write(declaration((StartDocument) event));
                    continue;
                }
                runs.accept(event);
            }
            writer.flush();
            sink.flush();

            return runs.substituted() ? out.toByteArray() : null;
        } catch (XMLStreamException | IOException | IllegalStateException e) {
            throw new XmlPartUnparseableException(e.getMessage(), e);
        } finally {
            close(reader, writer);
        }
    }

    private static XMLInputFactory inputFactory() {
        XMLInputFactory factory = XMLInputFactory.newDefaultFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    private static String declaration(StartDocument start) {
        StringBuilder sb = new StringBuilder("<?xml version=\"")
                .append(start.getVersion() != null ? start.getVersion() : "1.0")
                .append("\" encoding=\"UTF-8\"");
        if (start.standaloneSet()) {
            sb.append(" standalone=\"").append(start.isStandalone() ? "yes" : "no").append('"');
        }
        return sb.append("?>").toString();
    }

    private static ZipEntry targetEntry(ZipEntry source, byte[] data) {
        ZipEntry target = new ZipEntry(source.getName());
        if (source.getTime() != -1) {
            target.setTime(source.getTime());
        }
        if (source.getMethod() == ZipEntry.STORED) {
            CRC32 crc = new CRC32();
            crc.update(data);
            target.setMethod(ZipEntry.STORED);
            target.setSize(data.length);
            target.setCompressedSize(data.length);
            target.setCrc(crc.getValue());
        }
        return target;
    }

    private static void close(XMLEventReader reader, XMLEventWriter writer) {
        try {
            if (reader != null) {
                reader.close();
            }
            if (writer != null) {
                writer.close();
            }
        } catch (XMLStreamException e) {
            log.debugf("Failed to close XML stream: %s", e.getMessage());
        }
    }
}
