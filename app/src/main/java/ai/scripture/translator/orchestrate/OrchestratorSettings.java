package ai.scripture.translator.orchestrate;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for a translation run.
 *
 * @param splitThreshold     chunks longer than this are translated fragment by fragment
 * @param failureCooldown    pause after a chunk exhausts its retry budget
 * @param progressInterval   emit a progress snapshot every this many processed chunks
 * @param minJoinedLength    joined fragment translations must be longer than this to count
 * @param estimatePerChunk   per-chunk duration used for the pre-run estimate
 */
public record OrchestratorSettings(int splitThreshold, Duration failureCooldown, int progressInterval,
                                   int minJoinedLength, Duration estimatePerChunk) {

    public static final int DEFAULT_SPLIT_THRESHOLD = 4000;
    public static final int DEFAULT_PROGRESS_INTERVAL = 20;

    public OrchestratorSettings {
        if (splitThreshold < 1) {
            throw new IllegalArgumentException("splitThreshold must be positive");
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be positive");
        }
        if (minJoinedLength < 0) {
            throw new IllegalArgumentException("minJoinedLength must not be negative");
        }
        Objects.requireNonNull(failureCooldown, "failureCooldown");
        Objects.requireNonNull(estimatePerChunk, "estimatePerChunk");
        if (failureCooldown.isNegative() || estimatePerChunk.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(DEFAULT_SPLIT_THRESHOLD, Duration.ofSeconds(10), DEFAULT_PROGRESS_INTERVAL,
                10, Duration.ofSeconds(5));
    }

    public OrchestratorSettings withSplitThreshold(int value) {
        return new OrchestratorSettings(value, failureCooldown, progressInterval, minJoinedLength, estimatePerChunk);
    }

    public OrchestratorSettings withFailureCooldown(Duration value) {
        return new OrchestratorSettings(splitThreshold, value, progressInterval, minJoinedLength, estimatePerChunk);
    }

    public OrchestratorSettings withProgressInterval(int value) {
        return new OrchestratorSettings(splitThreshold, failureCooldown, value, minJoinedLength, estimatePerChunk);
    }
}
