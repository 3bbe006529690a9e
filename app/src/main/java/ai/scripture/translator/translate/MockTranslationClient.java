package ai.scripture.translator.translate;

/**
 * Mock client used to exercise the pipeline without calling a remote service.
 */
public class MockTranslationClient implements TranslationClient {

    @Override
    public String translate(String text) {
        return "[MOCK] " + text;
    }
}
