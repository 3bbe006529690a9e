package ai.scripture.translator.translate;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of the retry policy for one unit of text: either a qualifying translation or exhaustion.
 */
public record TranslationOutcome(Optional<String> translation, int attempts, Optional<FailureKind> lastFailure) {

    public TranslationOutcome {
        translation = translation == null ? Optional.empty() : translation;
        lastFailure = lastFailure == null ? Optional.empty() : lastFailure;
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
    }

    public static TranslationOutcome success(String translation, int attempts) {
        return new TranslationOutcome(Optional.of(Objects.requireNonNull(translation, "translation")), attempts, Optional.empty());
    }

    public static TranslationOutcome exhausted(int attempts, Optional<FailureKind> lastFailure) {
        return new TranslationOutcome(Optional.empty(), attempts, lastFailure);
    }

    public boolean isSuccess() {
        return translation.isPresent();
    }

    public boolean isExhausted() {
        return translation.isEmpty();
    }
}
