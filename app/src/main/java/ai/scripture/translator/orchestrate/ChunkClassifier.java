package ai.scripture.translator.orchestrate;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether chunk content is worth sending to a translator or gets a terminal sentinel instead.
 *
 * <p>Checks run in order: empty, numeric, too short. A sentinel is written once and never retried.
 */
public class ChunkClassifier {

    public static final String EMPTY_SENTINEL = "[empty]";
    public static final String TOO_SHORT_SENTINEL = "[too short]";
    private static final Pattern NUMERIC = Pattern.compile("[\\p{Nd}\\s.,]*\\p{Nd}[\\p{Nd}\\s.,]*");

    private final int minContentLength;

    public ChunkClassifier() {
        this(3);
    }

    public ChunkClassifier(int minContentLength) {
        if (minContentLength < 1) {
            throw new IllegalArgumentException("minContentLength must be at least 1");
        }
        this.minContentLength = minContentLength;
    }

    public Classification classify(String content) {
        String trimmed = content == null ? "" : content.strip();
        if (trimmed.isEmpty()) {
            return new Classification(Kind.EMPTY, Optional.of(EMPTY_SENTINEL));
        }
        if (NUMERIC.matcher(trimmed).matches()) {
            return new Classification(Kind.NUMERIC, Optional.of("[numeric: " + trimmed + "]"));
        }
        if (trimmed.length() < minContentLength) {
            return new Classification(Kind.TOO_SHORT, Optional.of(TOO_SHORT_SENTINEL));
        }
        return new Classification(Kind.TRANSLATABLE, Optional.empty());
    }

    public enum Kind {
        EMPTY,
        NUMERIC,
        TOO_SHORT,
        TRANSLATABLE
    }

    public record Classification(Kind kind, Optional<String> sentinel) {

        public boolean translatable() {
            return kind == Kind.TRANSLATABLE;
        }
    }
}
