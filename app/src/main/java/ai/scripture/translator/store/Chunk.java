package ai.scripture.translator.store;

import java.util.Objects;
import java.util.Optional;

/**
 * A bounded unit of source-language content plus the translation state persisted alongside it.
 */
public record Chunk(long chunkId, String section, String content, int charCount, Optional<String> translation) {

    public Chunk {
        if (chunkId < 1) {
            throw new IllegalArgumentException("chunkId must be positive");
        }
        section = Objects.requireNonNull(section, "section");
        content = Objects.requireNonNull(content, "content");
        if (charCount < 0) {
            throw new IllegalArgumentException("charCount must not be negative");
        }
        translation = translation == null ? Optional.empty() : translation;
    }

    public static Chunk of(long chunkId, String section, String content) {
        return new Chunk(chunkId, section, content, content.length(), Optional.empty());
    }

    public boolean isTranslated() {
        return translation.isPresent();
    }

    public Chunk withTranslation(String value) {
        return new Chunk(chunkId, section, content, charCount, Optional.of(value));
    }

    public String preview(int maxLength) {
        if (content.length() <= maxLength) {
            return content;
        }
        return content.substring(0, maxLength) + "...";
    }
}
