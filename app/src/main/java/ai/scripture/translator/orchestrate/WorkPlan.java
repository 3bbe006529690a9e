package ai.scripture.translator.orchestrate;

import ai.scripture.translator.store.Chunk;
import ai.scripture.translator.store.ChunkRange;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Pre-run overview of a translation range shown to the operator before confirming.
 */
public record WorkPlan(ChunkRange range, long totalInRange, long pending, List<Chunk> samples,
                       Duration estimatedDuration) {

    public WorkPlan {
        range = Objects.requireNonNull(range, "range");
        samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
        estimatedDuration = Objects.requireNonNull(estimatedDuration, "estimatedDuration");
    }

    public boolean nothingPending() {
        return pending == 0;
    }
}
