package ai.scripture.translator.orchestrate;

import ai.scripture.translator.store.ChunkRange;
import java.util.Objects;

/**
 * Store-verified completion counts for a chunk range.
 */
public record VerificationReport(ChunkRange range, long total, long translated, long untranslated) {

    public VerificationReport {
        range = Objects.requireNonNull(range, "range");
    }

    public double percentTranslated() {
        return total == 0 ? 0.0 : translated * 100.0 / total;
    }

    public boolean complete() {
        return untranslated == 0;
    }
}
