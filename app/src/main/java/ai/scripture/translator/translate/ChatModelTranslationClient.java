package ai.scripture.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;

/**
 * Translation client backed by a LangChain4j {@link ChatModel}, either a local Ollama model or a hosted one.
 */
public class ChatModelTranslationClient implements TranslationClient {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final String sourceLanguage;
    private final String targetLanguage;

    public ChatModelTranslationClient(ChatModel model, String providerName, String modelName,
                                      String sourceLanguage, String targetLanguage) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        this.targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
    }

    @Override
    public String translate(String text) {
        if (text == null || text.isBlank()) {
            throw new TranslationException(FailureKind.OTHER, "Nothing to translate", null);
        }
        String response;
        try {
            response = model.chat(buildPrompt(text));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException(FailureKind.OTHER,
                        "%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("%s translation failed: %s".formatted(providerName, ex.getMessage()), ex);
        }
        if (response == null) {
            throw new TranslationException(FailureKind.OTHER, providerName + " returned no content", null);
        }
        return stripWrapping(response.strip());
    }

    String buildPrompt(String text) {
        String source = "auto".equalsIgnoreCase(sourceLanguage)
                ? "the source language (detect it; usually Sanskrit or Hindi in Devanagari script)"
                : "language '" + sourceLanguage + "'";
        return """
Translate the text below from %s into natural, faithful language '%s'.
Rules:
- Translate every sentence; do not summarize, explain, or add commentary.
- Keep proper names of deities, sages, and places, transliterated into Latin script.
- Output only the translation as plain text, without quotes or tags.

<text>
%s
</text>""".formatted(source, targetLanguage, text);
    }

    private String stripWrapping(String response) {
        String cleaned = response;
        if (cleaned.startsWith("<text>")) {
            cleaned = cleaned.substring("<text>".length());
        }
        if (cleaned.endsWith("</text>")) {
            cleaned = cleaned.substring(0, cleaned.length() - "</text>".length());
        }
        return cleaned.strip();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
