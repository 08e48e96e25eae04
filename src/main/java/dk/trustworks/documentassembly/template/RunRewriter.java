package dk.trustworks.documentassembly.template;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventFactory;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.EndElement;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Streaming rewriter for one WordprocessingML part.
 *
 * <p>Events outside text elements pass straight through. The text of each {@code w:t} is
 * collected into a {@link BufferedRun}; while the collected text could still be the start of a
 * placeholder that a later run completes, following runs and the markup between them are
 * buffered too. The buffer is substituted and flushed as soon as no token is left open, and
 * always at a paragraph start or end, a table-row end, and the end of the document.
 *
 * <p>Not thread-safe; one instance per part.
 */
final class RunRewriter {

    enum State {
        OUTSIDE_RUN,
        INSIDE_RUN,
        BETWEEN_RUNS_BUFFERING_FOR_JOIN
    }

    static final Set<String> WORDPROCESSING_NAMESPACES = Set.of(
            "http://schemas.openxmlformats.org/wordprocessingml/2006/main",
            "http://purl.oclc.org/ooxml/wordprocessingml/main");

    private static final QName XML_SPACE = new QName(XMLConstants.XML_NS_URI, "space", XMLConstants.XML_NS_PREFIX);

    private final XMLEventWriter writer;
    private final XMLEventFactory events;
    private final Map<String, Pattern> patterns;
    private final PlaceholderMap values;

    private final List<BufferedRun> buffer = new ArrayList<>();
    private final StringBuilder currentText = new StringBuilder();
    private StartElement currentStart;
    private State state = State.OUTSIDE_RUN;
    private boolean substituted;

    RunRewriter(XMLEventWriter writer, XMLEventFactory events, Map<String, Pattern> patterns, PlaceholderMap values) {
        this.writer = writer;
        this.events = events;
        this.patterns = patterns;
        this.values = values;
    }

    State state() {
        return state;
    }

    boolean substituted() {
        return substituted;
    }

    void accept(XMLEvent event) throws XMLStreamException, XmlPartUnparseableException {
        if (state == State.INSIDE_RUN) {
            insideRun(event);
        } else {
            outsideRun(event);
        }
    }

    private void outsideRun(XMLEvent event) throws XMLStreamException {
        if (event.isStartElement()) {
            StartElement start = event.asStartElement();
            if (isWordElement(start.getName(), "t")) {
                currentStart = start;
                currentText.setLength(0);
                state = State.INSIDE_RUN;
                return;
            }
            if (isWordElement(start.getName(), "p")) {
                flush();
            }
        } else if (event.isEndElement()) {
            QName name = event.asEndElement().getName();
            if (isWordElement(name, "p") || isWordElement(name, "tr")) {
                flush();
            }
        } else if (event.isEndDocument()) {
            flush();
        }

        if (state == State.BETWEEN_RUNS_BUFFERING_FOR_JOIN) {
            buffer.get(buffer.size() - 1).trailing().add(event);
        } else {
            writer.add(event);
        }
    }

    private void insideRun(XMLEvent event) throws XMLStreamException, XmlPartUnparseableException {
        if (event.isCharacters()) {
            currentText.append(event.asCharacters().getData());
            return;
        }
        if (event.isEndElement() && isWordElement(event.asEndElement().getName(), "t")) {
            buffer.add(new BufferedRun(currentStart, currentText.toString(), event.asEndElement(), new ArrayList<>()));
            currentStart = null;
            if (hasOpenToken(bufferedText())) {
                state = State.BETWEEN_RUNS_BUFFERING_FOR_JOIN;
            } else {
                flush();
            }
            return;
        }
        throw new XmlPartUnparseableException("unexpected " + describe(event) + " inside a text element");
    }

    private void flush() throws XMLStreamException {
        if (!buffer.isEmpty()) {
            List<String> texts = new ArrayList<>(buffer.size());
            for (BufferedRun run : buffer) {
                texts.add(run.text());
            }
            List<List<String>> replaced = RunSpanSubstitutor.substitute(texts, patterns, values);
            if (replaced != null) {
                substituted = true;
            }
            for (int i = 0; i < buffer.size(); i++) {
                emit(buffer.get(i), replaced != null ? replaced.get(i) : null);
            }
            buffer.clear();
        }
        state = State.OUTSIDE_RUN;
    }

    private void emit(BufferedRun run, List<String> fragments) throws XMLStreamException {
        if (fragments == null || (fragments.size() == 1 && fragments.get(0).equals(run.text()))) {
            writer.add(run.textStart());
            if (!run.text().isEmpty()) {
                writer.add(events.createCharacters(run.text()));
            }
        } else {
            QName textName = run.textStart().getName();
            writer.add(preserveSpace(run.textStart()));
            for (int i = 0; i < fragments.size(); i++) {
                if (i > 0) {
                    QName brName = new QName(textName.getNamespaceURI(), "br", textName.getPrefix());
                    writer.add(events.createEndElement(textName, Collections.emptyIterator()));
                    writer.add(events.createStartElement(brName, Collections.emptyIterator(), Collections.emptyIterator()));
                    writer.add(events.createEndElement(brName, Collections.emptyIterator()));
                    writer.add(events.createStartElement(textName,
                            List.of(events.createAttribute(XML_SPACE, "preserve")).iterator(),
                            Collections.emptyIterator()));
                }
                if (!fragments.get(i).isEmpty()) {
                    writer.add(events.createCharacters(fragments.get(i)));
                }
            }
        }
        writer.add(run.textEnd());
        for (XMLEvent trailing : run.trailing()) {
            writer.add(trailing);
        }
    }

    private StartElement preserveSpace(StartElement start) {
        List<Attribute> attributes = new ArrayList<>();
        Iterator<Attribute> it = start.getAttributes();
        while (it.hasNext()) {
            Attribute attribute = it.next();
            if (!XML_SPACE.equals(attribute.getName())) {
                attributes.add(attribute);
            }
        }
        attributes.add(events.createAttribute(XML_SPACE, "preserve"));
        return events.createStartElement(start.getName(), attributes.iterator(), start.getNamespaces());
    }

    private String bufferedText() {
        StringBuilder sb = new StringBuilder();
        for (BufferedRun run : buffer) {
            sb.append(run.text());
        }
        return sb.toString();
    }

    /**
     * True when the text ends inside a possible placeholder: an opening double brace with no
     * closing double brace after it, or a trailing single opening brace.
     */
    static boolean hasOpenToken(String text) {
        if (text.endsWith("{")) {
            return true;
        }
        int open = text.lastIndexOf("{{");
        return open >= 0 && text.indexOf("}}", open + 2) < 0;
    }

    static boolean isWordElement(QName name, String localName) {
        return localName.equals(name.getLocalPart()) && WORDPROCESSING_NAMESPACES.contains(name.getNamespaceURI());
    }

    private static String describe(XMLEvent event) {
        if (event.isStartElement()) {
            return "element <" + event.asStartElement().getName().getLocalPart() + ">";
        }
        return "event type " + event.getEventType();
    }

    /**
     * One {@code w:t} element with its collected text and the markup that follows it up to the
     * next text element.
     */
    record BufferedRun(StartElement textStart, String text, EndElement textEnd, List<XMLEvent> trailing) {
    }
}
