package ai.scripture.translator.orchestrate;

import java.time.Duration;
import java.util.Objects;

/**
 * In-memory tally of one orchestrator run. The store-backed {@link VerificationReport} is authoritative.
 */
public record RunSummary(int worklistSize, int translated, int skipped, int failed, Duration elapsed,
                         boolean interrupted) {

    public RunSummary {
        elapsed = Objects.requireNonNull(elapsed, "elapsed");
    }

    public int processed() {
        return translated + skipped + failed;
    }

    public Duration averagePerTranslated() {
        return translated == 0 ? Duration.ZERO : elapsed.dividedBy(translated);
    }
}
