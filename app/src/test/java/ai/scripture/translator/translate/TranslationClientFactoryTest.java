package ai.scripture.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TranslationClientFactoryTest {

    @Test
    void mockModeNeverBuildsProductionClient() {
        AtomicInteger builds = new AtomicInteger();
        TranslationClientFactory factory = new TranslationClientFactory(() -> {
            builds.incrementAndGet();
            return text -> "real";
        }, new MockTranslationClient());

        TranslationClient client = factory.select(TranslationMode.MOCK);

        assertThat(client.translate("पाठ")).isEqualTo("[MOCK] पाठ");
        assertThat(builds).hasValue(0);
    }

    @Test
    void productionModeUsesSuppliedClient() {
        TranslationClientFactory factory = new TranslationClientFactory(() -> text -> "real", new MockTranslationClient());

        assertThat(factory.select(TranslationMode.PRODUCTION).translate("पाठ")).isEqualTo("real");
    }

    @Test
    void parsesModeNames() {
        assertThat(TranslationMode.from("mock")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from(" Production ")).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(TranslationMode.from(null)).isEqualTo(TranslationMode.PRODUCTION);
        assertThatThrownBy(() -> TranslationMode.from("dry-run")).isInstanceOf(IllegalArgumentException.class);
    }
}
