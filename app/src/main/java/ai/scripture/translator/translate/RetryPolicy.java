package ai.scripture.translator.translate;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Attempt budget and backoff schedule applied around every translation call.
 *
 * <p>All attempt indexes are zero-based.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration delayStep,
        Duration maxJitter,
        Duration rateLimitCooldown,
        Duration rateLimitStep,
        Duration transientCooldown,
        Duration transientStep,
        Duration otherCooldown,
        int minResultLength
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        requireNotNegative(baseDelay, "baseDelay");
        requireNotNegative(delayStep, "delayStep");
        requireNotNegative(maxJitter, "maxJitter");
        requireNotNegative(rateLimitCooldown, "rateLimitCooldown");
        requireNotNegative(rateLimitStep, "rateLimitStep");
        requireNotNegative(transientCooldown, "transientCooldown");
        requireNotNegative(transientStep, "transientStep");
        requireNotNegative(otherCooldown, "otherCooldown");
        if (minResultLength < 1) {
            throw new IllegalArgumentException("minResultLength must be at least 1");
        }
    }

    public static RetryPolicy defaults() {
        return withMaxAttempts(5);
    }

    public static RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts,
                Duration.ofSeconds(3), Duration.ofSeconds(2), Duration.ofSeconds(2),
                Duration.ofSeconds(20), Duration.ofSeconds(10),
                Duration.ofSeconds(10), Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                3);
    }

    /**
     * Throttling delay applied before every attempt, including the first.
     */
    public Duration preAttemptDelay(int attempt, Random random) {
        Duration progressive = baseDelay.plus(delayStep.multipliedBy(attempt));
        long jitterMillis = maxJitter.toMillis();
        if (jitterMillis <= 0) {
            return progressive;
        }
        return progressive.plusMillis((long) (random.nextDouble() * jitterMillis));
    }

    public Duration cooldown(FailureKind kind, int attempt) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case RATE_LIMITED -> rateLimitCooldown.plus(rateLimitStep.multipliedBy(attempt));
            case TRANSIENT -> transientCooldown.plus(transientStep.multipliedBy(attempt));
            case OTHER -> otherCooldown;
        };
    }

    public boolean isFinalAttempt(int attempt) {
        return attempt >= maxAttempts - 1;
    }

    private static void requireNotNegative(Duration value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isNegative()) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
