package ai.scripture.translator.translate;

import java.util.Objects;

/**
 * Runtime exception used to propagate translation failures together with their retry classification.
 */
public class TranslationException extends RuntimeException {

    private final FailureKind kind;

    public TranslationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TranslationException(String message, Throwable cause) {
        this(FailureClassifier.classify(cause), message, cause);
    }

    public FailureKind kind() {
        return kind;
    }
}
