package ai.scripture.translator.orchestrate;

import ai.scripture.translator.store.Chunk;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.store.ChunkStore;
import ai.scripture.translator.store.ChunkStoreException;
import ai.scripture.translator.store.TranslationState;
import ai.scripture.translator.translate.RetryingTranslator;
import ai.scripture.translator.translate.SentenceSplitter;
import ai.scripture.translator.translate.Sleeper;
import ai.scripture.translator.translate.TranslationOutcome;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives every untranslated chunk in a range through classification and translation, one chunk at a time.
 *
 * <p>The worklist is re-read from the store on every run, so an interrupted run resumes where it stopped.
 * Each chunk gets at most one write: a translation, a sentinel, or nothing at all.
 */
public class TranslationOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationOrchestrator.class);
    static final String MDC_CHUNK_ID = "chunkId";
    private static final int SAMPLE_COUNT = 3;
    private static final String FRAGMENT_SEPARATOR = " ";

    private final ChunkStore store;
    private final RetryingTranslator translator;
    private final SentenceSplitter splitter;
    private final ChunkClassifier classifier;
    private final Verifier verifier;
    private final OrchestratorSettings settings;
    private final Sleeper sleeper;
    private final Clock clock;

    public TranslationOrchestrator(ChunkStore store, RetryingTranslator translator, OrchestratorSettings settings) {
        this(store, translator, new SentenceSplitter(), new ChunkClassifier(), settings, Sleeper.system(),
                Clock.systemUTC());
    }

    public TranslationOrchestrator(ChunkStore store, RetryingTranslator translator, SentenceSplitter splitter,
                                   ChunkClassifier classifier, OrchestratorSettings settings, Sleeper sleeper,
                                   Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.verifier = new Verifier(store);
    }

    /**
     * Summarises what a run over {@code range} would do without touching any row.
     */
    public WorkPlan plan(ChunkRange range, int limit) {
        Objects.requireNonNull(range, "range");
        long total = store.count(range, TranslationState.ANY);
        long pending = store.count(range, TranslationState.UNTRANSLATED);
        if (limit > 0) {
            pending = Math.min(pending, limit);
        }
        List<Chunk> samples = pending == 0 ? List.of() : store.findUntranslated(range, SAMPLE_COUNT);
        Duration estimate = settings.estimatePerChunk().multipliedBy(pending);

        LOGGER.info("Chunks {}: {} in range, {} pending translation", range, total, pending);
        for (Chunk sample : samples) {
            LOGGER.info("  sample chunk {} [{}] {} chars: {}", sample.chunkId(), sample.section(), sample.charCount(),
                    sample.preview(100));
        }
        if (pending > 0) {
            LOGGER.info("Estimated duration: {} ({}s per chunk)", ProgressTracker.minutes(estimate),
                    settings.estimatePerChunk().toSeconds());
        }
        return new WorkPlan(range, total, pending, samples, estimate);
    }

    /**
     * Translates the untranslated chunks in {@code range} and verifies the result against the store.
     *
     * @param limit maximum number of chunks to process, or {@code 0} for all of them
     */
    public RunReport run(ChunkRange range, int limit) {
        Objects.requireNonNull(range, "range");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        List<Chunk> worklist = store.findUntranslated(range, limit);
        LOGGER.info("Discovered {} untranslated chunks in range {}", worklist.size(), range);

        ProgressTracker progress = new ProgressTracker(clock, worklist.size());
        boolean interrupted = false;
        for (Chunk chunk : worklist) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            MDC.put(MDC_CHUNK_ID, Long.toString(chunk.chunkId()));
            try {
                interrupted = !processChunk(chunk, progress);
            } finally {
                MDC.remove(MDC_CHUNK_ID);
            }
            if (progress.processed() % settings.progressInterval() == 0) {
                LOGGER.info(progress.snapshot());
            }
            if (interrupted) {
                break;
            }
        }

        RunSummary summary = progress.summary(interrupted);
        if (interrupted) {
            LOGGER.warn("Run interrupted after {} of {} chunks; remaining chunks stay pending",
                    summary.processed(), summary.worklistSize());
        }
        LOGGER.info("Run finished in {}: translated {}, skipped {}, failed {}",
                ProgressTracker.minutes(summary.elapsed()), summary.translated(), summary.skipped(), summary.failed());
        if (summary.translated() > 0) {
            LOGGER.info("Average time per translated chunk: {}s", summary.averagePerTranslated().toSeconds());
        }
        return new RunReport(summary, verifyAfterRun(range, interrupted));
    }

    public VerificationReport verify(ChunkRange range) {
        return verifier.verify(Objects.requireNonNull(range, "range"));
    }

    /**
     * @return {@code false} when the thread was interrupted while waiting
     */
    private boolean processChunk(Chunk chunk, ProgressTracker progress) {
        ChunkClassifier.Classification classification = classifier.classify(chunk.content());
        if (!classification.translatable()) {
            String sentinel = classification.sentinel().orElseThrow();
            LOGGER.debug("Chunk {} classified {}; writing {}", chunk.chunkId(), classification.kind(), sentinel);
            if (write(chunk, sentinel)) {
                progress.recordSkipped();
            } else {
                progress.recordFailed();
            }
            return true;
        }

        Optional<String> translation = translate(chunk);
        if (translation.isPresent()) {
            if (write(chunk, translation.get())) {
                progress.recordTranslated();
                LOGGER.debug("Chunk {} translated ({} -> {} chars)", chunk.chunkId(), chunk.charCount(),
                        translation.get().length());
            } else {
                progress.recordFailed();
            }
            return !Thread.currentThread().isInterrupted();
        }

        progress.recordFailed();
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        LOGGER.warn("Chunk {} could not be translated; left pending, cooling down {}s", chunk.chunkId(),
                settings.failureCooldown().toSeconds());
        try {
            sleeper.sleep(settings.failureCooldown());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Optional<String> translate(Chunk chunk) {
        String content = chunk.content();
        if (content.length() <= settings.splitThreshold()) {
            TranslationOutcome outcome = translator.translateWithPolicy(content);
            return outcome.translation();
        }

        List<String> fragments = splitter.split(content);
        LOGGER.info("Chunk {} has {} chars; translating {} fragments", chunk.chunkId(), content.length(),
                fragments.size());
        List<String> translated = new ArrayList<>(fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }
            TranslationOutcome outcome = translator.translateWithPolicy(fragments.get(i));
            if (outcome.isSuccess()) {
                translated.add(outcome.translation().get());
            } else {
                LOGGER.warn("Fragment {}/{} of chunk {} failed after {} attempts", i + 1, fragments.size(),
                        chunk.chunkId(), outcome.attempts());
            }
        }
        String joined = String.join(FRAGMENT_SEPARATOR, translated).strip();
        if (joined.length() > settings.minJoinedLength()) {
            return Optional.of(joined);
        }
        return Optional.empty();
    }

    private boolean write(Chunk chunk, String value) {
        try {
            store.updateTranslation(chunk.chunkId(), value);
            return true;
        } catch (ChunkStoreException ex) {
            LOGGER.error("Failed to store translation for chunk {}: {}", chunk.chunkId(), ex.getMessage(), ex);
            return false;
        }
    }

    private VerificationReport verifyAfterRun(ChunkRange range, boolean interrupted) {
        if (!interrupted) {
            return verifier.verify(range);
        }
        // Blocking store calls refuse to start while the interrupt flag is set.
        boolean flag = Thread.interrupted();
        try {
            return verifier.verify(range);
        } finally {
            if (flag) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * In-memory run tally together with the store-verified counts taken right after it.
     */
    public record RunReport(RunSummary summary, VerificationReport verification) {

        public RunReport {
            summary = Objects.requireNonNull(summary, "summary");
            verification = Objects.requireNonNull(verification, "verification");
        }
    }
}
