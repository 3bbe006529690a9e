package ai.scripture.translator.store;

/**
 * Filter on the nullable translation column used by count queries.
 */
public enum TranslationState {
    ANY,
    TRANSLATED,
    UNTRANSLATED;

    public boolean matches(Chunk chunk) {
        return switch (this) {
            case ANY -> true;
            case TRANSLATED -> chunk.isTranslated();
            case UNTRANSLATED -> !chunk.isTranslated();
        };
    }
}
