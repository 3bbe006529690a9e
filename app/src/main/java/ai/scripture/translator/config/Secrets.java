package ai.scripture.translator.config;

import java.util.Optional;

/**
 * Holds sensitive credentials needed for external integrations.
 */
public record Secrets(Optional<String> supabaseKey, Optional<String> geminiApiKey) {

    public Secrets {
        supabaseKey = supabaseKey == null ? Optional.empty() : supabaseKey;
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    @Override
    public String toString() {
        return "Secrets[supabaseKey=" + mask(supabaseKey) + ", geminiApiKey=" + mask(geminiApiKey) + "]";
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "***" : "<unset>";
    }
}
