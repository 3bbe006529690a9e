package ai.scripture.translator.translate;

import dev.langchain4j.exception.RateLimitException;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary client failures onto {@link FailureKind} by walking the cause chain.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable throwable) {
        if (throwable == null) {
            return FailureKind.OTHER;
        }
        boolean transientSeen = false;
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof TranslationException translationException) {
                return translationException.kind();
            }
            if (cause instanceof RateLimitException || mentionsRateLimit(cause.getMessage())) {
                return FailureKind.RATE_LIMITED;
            }
            if (cause instanceof IOException || cause instanceof TimeoutException || mentionsConnectivity(cause.getMessage())) {
                transientSeen = true;
            }
            cause = cause.getCause();
        }
        return transientSeen ? FailureKind.TRANSIENT : FailureKind.OTHER;
    }

    public static FailureKind forHttpStatus(int status) {
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status == 408 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.OTHER;
    }

    private static boolean mentionsRateLimit(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("too many requests")
                || lower.contains("rate limit")
                || message.contains("RESOURCE_EXHAUSTED")
                || message.contains("429");
    }

    private static boolean mentionsConnectivity(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("connection") || lower.contains("timed out") || lower.contains("timeout");
    }
}
