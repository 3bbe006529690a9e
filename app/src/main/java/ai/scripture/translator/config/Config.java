package ai.scripture.translator.config;

import ai.scripture.translator.orchestrate.OrchestratorSettings;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.translate.RetryPolicy;
import ai.scripture.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Command command,
        Optional<Path> sourceFile,
        int chunkSize,
        int uploadBatchSize,
        StoreConfig store,
        ChunkRange range,
        int limit,
        boolean dryRun,
        boolean autoConfirm,
        TranslationMode translationMode,
        LogFormat logFormat,
        boolean verbose,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        int splitThreshold,
        int maxAttempts,
        int failureCooldownSeconds,
        int progressInterval
) {

    public Config {
        Objects.requireNonNull(command, "command");
        sourceFile = sourceFile == null ? Optional.empty() : sourceFile;
        requirePositive(chunkSize, "chunkSize");
        requirePositive(uploadBatchSize, "uploadBatchSize");
        store = Objects.requireNonNull(store, "store");
        range = Objects.requireNonNull(range, "range");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be greater than or equal to zero");
        }
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        requirePositive(splitThreshold, "splitThreshold");
        requirePositive(maxAttempts, "maxAttempts");
        if (failureCooldownSeconds < 0) {
            throw new IllegalArgumentException("failureCooldownSeconds must be greater than or equal to zero");
        }
        requirePositive(progressInterval, "progressInterval");
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.withMaxAttempts(maxAttempts);
    }

    public OrchestratorSettings orchestratorSettings() {
        return OrchestratorSettings.defaults()
                .withSplitThreshold(splitThreshold)
                .withFailureCooldown(Duration.ofSeconds(failureCooldownSeconds))
                .withProgressInterval(progressInterval);
    }

    private static void requirePositive(int value, String field) {
        if (value < 1) {
            throw new IllegalArgumentException(field + " must be greater than zero");
        }
    }
}
