package ai.scripture.translator.translate;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link TranslationClient} through a bounded number of attempts with classified backoff.
 *
 * <p>The loop always terminates within {@link RetryPolicy#maxAttempts()} calls. A response only counts as a
 * translation when it is non-blank, differs from the input and reaches the policy's minimum length; an echoed
 * input is treated as a failed attempt.
 */
public class RetryingTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingTranslator.class);

    private final TranslationClient client;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Random random;

    public RetryingTranslator(TranslationClient client, RetryPolicy policy) {
        this(client, policy, Sleeper.system(), new Random());
    }

    public RetryingTranslator(TranslationClient client, RetryPolicy policy, Sleeper sleeper, Random random) {
        this.client = Objects.requireNonNull(client, "client");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    public TranslationOutcome translateWithPolicy(String text) {
        if (text == null || text.isBlank()) {
            return TranslationOutcome.exhausted(0, Optional.empty());
        }
        String source = text.strip();
        Optional<FailureKind> lastFailure = Optional.empty();
        int attempts = 0;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            if (!pause(policy.preAttemptDelay(attempt, random))) {
                return TranslationOutcome.exhausted(attempts, lastFailure);
            }
            attempts++;
            try {
                String result = client.translate(source);
                if (qualifies(result, source)) {
                    if (attempt > 0) {
                        LOGGER.debug("Translation succeeded on attempt {}/{}", attempt + 1, policy.maxAttempts());
                    }
                    return TranslationOutcome.success(result.strip(), attempts);
                }
                LOGGER.debug("Attempt {}/{} returned an unusable translation", attempt + 1, policy.maxAttempts());
            } catch (RuntimeException ex) {
                FailureKind kind = FailureClassifier.classify(ex);
                lastFailure = Optional.of(kind);
                if (Thread.currentThread().isInterrupted()) {
                    return TranslationOutcome.exhausted(attempts, lastFailure);
                }
                if (policy.isFinalAttempt(attempt)) {
                    LOGGER.error("All {} translation attempts failed ({}): {}", policy.maxAttempts(), kind, ex.getMessage());
                    break;
                }
                Duration cooldown = policy.cooldown(kind, attempt);
                switch (kind) {
                    case RATE_LIMITED -> LOGGER.warn("Rate limited; waiting {}s before attempt {}/{}",
                            cooldown.toSeconds(), attempt + 2, policy.maxAttempts());
                    case TRANSIENT -> LOGGER.warn("Connection issue ({}); waiting {}s before attempt {}/{}",
                            ex.getMessage(), cooldown.toSeconds(), attempt + 2, policy.maxAttempts());
                    case OTHER -> LOGGER.warn("Attempt {}/{} failed: {}", attempt + 1, policy.maxAttempts(), ex.getMessage());
                }
                if (!pause(cooldown)) {
                    return TranslationOutcome.exhausted(attempts, lastFailure);
                }
            }
        }
        return TranslationOutcome.exhausted(attempts, lastFailure);
    }

    private boolean qualifies(String result, String source) {
        if (result == null) {
            return false;
        }
        String cleaned = result.strip();
        return !cleaned.isEmpty()
                && !cleaned.equals(source)
                && cleaned.length() >= policy.minResultLength();
    }

    private boolean pause(Duration duration) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Translation backoff interrupted");
            return false;
        }
    }
}
