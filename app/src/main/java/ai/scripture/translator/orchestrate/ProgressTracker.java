package ai.scripture.translator.orchestrate;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Running counters for one orchestrator run plus the elapsed-time extrapolation behind progress snapshots.
 */
class ProgressTracker {

    private final Clock clock;
    private final int total;
    private final long startMillis;
    private int processed;
    private int translated;
    private int skipped;
    private int failed;

    ProgressTracker(Clock clock, int total) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.total = total;
        this.startMillis = clock.millis();
    }

    void recordTranslated() {
        translated++;
        processed++;
    }

    void recordSkipped() {
        skipped++;
        processed++;
    }

    void recordFailed() {
        failed++;
        processed++;
    }

    int processed() {
        return processed;
    }

    Duration elapsed() {
        return Duration.ofMillis(Math.max(0, clock.millis() - startMillis));
    }

    Duration averagePerChunk() {
        return processed == 0 ? Duration.ZERO : elapsed().dividedBy(processed);
    }

    Duration estimatedRemaining() {
        return averagePerChunk().multipliedBy(Math.max(0, total - processed));
    }

    double percentComplete() {
        return total == 0 ? 100.0 : processed * 100.0 / total;
    }

    RunSummary summary(boolean interrupted) {
        return new RunSummary(total, translated, skipped, failed, elapsed(), interrupted);
    }

    String snapshot() {
        return "Completed %d/%d (%.1f%%) | translated %d, skipped %d, failed %d | %s elapsed, ~%s remaining, %.1fs per chunk"
                .formatted(processed, total, percentComplete(), translated, skipped, failed,
                        minutes(elapsed()), minutes(estimatedRemaining()), averagePerChunk().toMillis() / 1000.0);
    }

    static String minutes(Duration duration) {
        return "%.1fm".formatted(duration.toMillis() / 60000.0);
    }
}
