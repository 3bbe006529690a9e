package ai.scripture.translator.translate;

/**
 * Classification of a failed translation call, used to pick a retry cooldown.
 */
public enum FailureKind {
    RATE_LIMITED,
    TRANSIENT,
    OTHER
}
