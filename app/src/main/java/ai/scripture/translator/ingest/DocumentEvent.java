package ai.scripture.translator.ingest;

import java.util.Objects;

/**
 * Structural event read from the source document, in reading order.
 */
public sealed interface DocumentEvent permits DocumentEvent.Heading, DocumentEvent.Paragraph {

    String text();

    static Heading heading(String text) {
        return new Heading(text);
    }

    static Paragraph paragraph(String text) {
        return new Paragraph(text);
    }

    record Heading(String text) implements DocumentEvent {
        public Heading {
            text = Objects.requireNonNull(text, "text");
        }
    }

    record Paragraph(String text) implements DocumentEvent {
        public Paragraph {
            text = Objects.requireNonNull(text, "text");
        }
    }
}
