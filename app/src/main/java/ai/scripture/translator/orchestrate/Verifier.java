package ai.scripture.translator.orchestrate;

import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.store.ChunkStore;
import ai.scripture.translator.store.TranslationState;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-reads aggregate translation counts from the store, independent of any in-memory counters.
 */
public class Verifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Verifier.class);

    private final ChunkStore store;

    public Verifier(ChunkStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public VerificationReport verify(ChunkRange range) {
        long total = store.count(range, TranslationState.ANY);
        long translated = store.count(range, TranslationState.TRANSLATED);
        long untranslated = store.count(range, TranslationState.UNTRANSLATED);
        VerificationReport report = new VerificationReport(range, total, translated, untranslated);

        LOGGER.info("Verification for chunks {}: total {}, translated {} ({}%), still null {}",
                range, total, translated, "%.1f".formatted(report.percentTranslated()), untranslated);
        if (report.complete()) {
            LOGGER.info("All chunks in range {} are translated", range);
        } else {
            LOGGER.warn("{} chunks still need translation; run again to retry them", untranslated);
        }
        return report;
    }
}
