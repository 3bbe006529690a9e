package ai.scripture.translator.ingest;

import ai.scripture.translator.store.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Packs paragraphs into chunks bounded by a character budget and tags each chunk with its section.
 *
 * <p>A chunk is tagged with the heading that is current when the chunk is sealed. When a heading arrives between
 * two paragraphs that end up in the same buffer, or right before the paragraph that overflows the buffer, the
 * sealed chunk therefore carries the newer heading.
 *
 * <p>The budget only decides where to cut: a single paragraph longer than the budget becomes its own oversized
 * chunk and is never truncated.
 */
public class ChunkAssembler {

    public static final String DEFAULT_SECTION = "Introduction";
    static final String PARAGRAPH_SEPARATOR = "\n";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxChunkSize;

    public ChunkAssembler(int maxChunkSize) {
        if (maxChunkSize < 1) {
            throw new IllegalArgumentException("maxChunkSize must be at least 1");
        }
        this.maxChunkSize = maxChunkSize;
    }

    public List<Chunk> assemble(Iterable<? extends DocumentEvent> events) {
        List<Chunk> chunks = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        String section = DEFAULT_SECTION;

        for (DocumentEvent event : events) {
            if (event instanceof DocumentEvent.Heading heading) {
                String title = normalize(heading.text());
                if (!title.isEmpty()) {
                    section = title;
                }
                continue;
            }
            String text = normalize(event.text());
            if (text.isEmpty()) {
                continue;
            }
            if (buffer.length() > 0 && buffer.length() + text.length() + PARAGRAPH_SEPARATOR.length() > maxChunkSize) {
                chunks.add(seal(chunks.size() + 1, section, buffer));
                buffer.setLength(0);
            }
            if (buffer.length() > 0) {
                buffer.append(PARAGRAPH_SEPARATOR);
            }
            buffer.append(text);
        }
        if (buffer.length() > 0) {
            chunks.add(seal(chunks.size() + 1, section, buffer));
        }
        return chunks;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw).replaceAll(" ").strip();
    }

    private static Chunk seal(int chunkId, String section, CharSequence buffer) {
        return Chunk.of(chunkId, section, buffer.toString());
    }
}
