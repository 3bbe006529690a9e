package ai.scripture.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides the translation client for the requested execution mode.
 */
public class TranslationClientFactory {

    private final Supplier<TranslationClient> productionClient;
    private final TranslationClient mockClient;

    public TranslationClientFactory(Supplier<TranslationClient> productionClient, TranslationClient mockClient) {
        this.productionClient = Objects.requireNonNull(productionClient, "productionClient");
        this.mockClient = Objects.requireNonNull(mockClient, "mockClient");
    }

    /**
     * The production client is built lazily so a mock run never needs provider credentials.
     */
    public TranslationClient select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> Objects.requireNonNull(productionClient.get(), "production client");
            case MOCK -> mockClient;
        };
    }
}
