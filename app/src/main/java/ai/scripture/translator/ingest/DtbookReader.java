package ai.scripture.translator.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams heading and paragraph events out of a DAISY DTBook XML file.
 *
 * <p>Elements are matched by local name so the DTBook namespace is optional. Paragraph and heading text is the
 * element's full text content, including inline children such as {@code em} or {@code span}.
 */
public class DtbookReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DtbookReader.class);
    private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");
    private static final String PARAGRAPH = "p";

    public List<DocumentEvent> read(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new SourceFormatException("Source document not found: " + source);
        }
        LOGGER.info("Parsing source document {}", source);
        try (InputStream in = Files.newInputStream(source)) {
            List<DocumentEvent> events = read(in);
            LOGGER.info("Read {} structural events from {}", events.size(), source.getFileName());
            return events;
        } catch (IOException ex) {
            throw new SourceFormatException("Unable to read source document " + source, ex);
        }
    }

    public List<DocumentEvent> read(InputStream in) {
        XMLStreamReader reader = null;
        try {
            reader = createFactory().createXMLStreamReader(in);
            List<DocumentEvent> events = new ArrayList<>();
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                String name = reader.getLocalName();
                if (HEADINGS.contains(name)) {
                    events.add(DocumentEvent.heading(collectText(reader)));
                } else if (PARAGRAPH.equals(name)) {
                    events.add(DocumentEvent.paragraph(collectText(reader)));
                }
            }
            return events;
        } catch (XMLStreamException ex) {
            throw new SourceFormatException("Malformed source document: " + ex.getMessage(), ex);
        } finally {
            close(reader);
        }
    }

    /**
     * Consumes the current element up to its matching end tag and returns the concatenated character data.
     */
    private String collectText(XMLStreamReader reader) throws XMLStreamException {
        StringBuilder text = new StringBuilder();
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> depth++;
                case XMLStreamConstants.END_ELEMENT -> depth--;
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE ->
                        text.append(reader.getText());
                default -> { }
            }
        }
        return text.toString();
    }

    private static XMLInputFactory createFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    private static void close(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException ex) {
            LOGGER.debug("Failed to close XML reader", ex);
        }
    }
}
