package ai.scripture.translator.translate;

/**
 * Single best-effort call to an external translation capability. Implementations never retry.
 */
@FunctionalInterface
public interface TranslationClient {

    /**
     * @param text non-empty source text
     * @return translated text
     * @throws TranslationException classified failure of this one call
     */
    String translate(String text);
}
