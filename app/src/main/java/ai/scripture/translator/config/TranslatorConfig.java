package ai.scripture.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation provider.
 */
public record TranslatorConfig(TranslationProvider provider, String modelName, Optional<String> baseUrl,
                               String sourceLanguage, String targetLanguage) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
    }

    public boolean isOllama() {
        return provider == TranslationProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
