package ai.scripture.translator.config;

import java.util.Locale;

/**
 * Backends able to translate chunk text.
 */
public enum TranslationProvider {
    GOOGLE,
    OLLAMA,
    GEMINI;

    public static TranslationProvider from(String value) {
        if (value == null) {
            return GOOGLE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "google", "" -> GOOGLE;
            case "ollama" -> OLLAMA;
            case "gemini" -> GEMINI;
            default -> throw new IllegalArgumentException("Unsupported translation provider: " + value);
        };
    }

    public boolean isChatModel() {
        return this != GOOGLE;
    }
}
