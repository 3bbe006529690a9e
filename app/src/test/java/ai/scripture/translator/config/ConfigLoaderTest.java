package ai.scripture.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.scripture.translator.cli.CliArguments;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.translate.TranslationMode;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesTranslateConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "translate",
                "--start", "10",
                "--end", "20",
                "--limit", "5",
                "--translation-mode", "mock",
                "--provider", "ollama",
                "--log-format", "json",
                "--yes",
                "--verbose");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(storeEnv())).load(cliArguments);

        assertThat(config.command()).isEqualTo(Command.TRANSLATE);
        assertThat(config.range()).isEqualTo(ChunkRange.between(10, 20));
        assertThat(config.limit()).isEqualTo(5);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.autoConfirm()).isTrue();
        assertThat(config.verbose()).isTrue();
        assertThat(config.translatorConfig().provider()).isEqualTo(TranslationProvider.OLLAMA);
        assertThat(config.translatorConfig().modelName()).isEqualTo("llama3.1:8b");
        assertThat(config.translatorConfig().baseUrl()).contains("http://localhost:11434");
        assertThat(config.store().url()).contains(URI.create("https://project.supabase.co"));
        assertThat(config.secrets().supabaseKey()).contains("service-key");
    }

    @Test
    void appliesDefaultsWhenNothingElseIsSet() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "translate");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(storeEnv())).load(cliArguments);

        assertThat(config.range()).isEqualTo(ChunkRange.all());
        assertThat(config.limit()).isZero();
        assertThat(config.dryRun()).isFalse();
        assertThat(config.autoConfirm()).isFalse();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.translatorConfig().provider()).isEqualTo(TranslationProvider.GOOGLE);
        assertThat(config.translatorConfig().baseUrl()).isEmpty();
        assertThat(config.translatorConfig().sourceLanguage()).isEqualTo("auto");
        assertThat(config.translatorConfig().targetLanguage()).isEqualTo("en");
        assertThat(config.store().table()).isEqualTo("shiv_puran_chunks");
        assertThat(config.store().translationColumn()).isEqualTo("english_translation");
        assertThat(config.chunkSize()).isEqualTo(1000);
        assertThat(config.uploadBatchSize()).isEqualTo(100);
        assertThat(config.retryPolicy().maxAttempts()).isEqualTo(5);
        assertThat(config.orchestratorSettings().splitThreshold()).isEqualTo(4000);
        assertThat(config.orchestratorSettings().failureCooldown()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.orchestratorSettings().progressInterval()).isEqualTo(20);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = storeEnv();
        envValues.put(ConfigLoader.ENV_CHUNK_TABLE, "gita_chunks");
        envValues.put(ConfigLoader.ENV_TRANSLATION_COLUMN, "hindi_translation");
        envValues.put(ConfigLoader.ENV_TRANSLATION_PROVIDER, "gemini");
        envValues.put(ConfigLoader.ENV_GEMINI_API_KEY, "gemini-key");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "gemini-2.0-flash");
        envValues.put(ConfigLoader.ENV_TARGET_LANGUAGE, "hi");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "mock");
        envValues.put(ConfigLoader.ENV_MAX_ATTEMPTS, "3");
        envValues.put(ConfigLoader.ENV_SPLIT_THRESHOLD, "2500");
        envValues.put(ConfigLoader.ENV_FAILURE_COOLDOWN_SECONDS, "0");
        envValues.put(ConfigLoader.ENV_PROGRESS_INTERVAL, "5");
        envValues.put(ConfigLoader.ENV_AUTO_CONFIRM, "yes");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "translate");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.store().table()).isEqualTo("gita_chunks");
        assertThat(config.store().translationColumn()).isEqualTo("hindi_translation");
        assertThat(config.translatorConfig().provider()).isEqualTo(TranslationProvider.GEMINI);
        assertThat(config.translatorConfig().modelName()).isEqualTo("gemini-2.0-flash");
        assertThat(config.translatorConfig().targetLanguage()).isEqualTo("hi");
        assertThat(config.secrets().geminiApiKey()).contains("gemini-key");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.retryPolicy().maxAttempts()).isEqualTo(3);
        assertThat(config.orchestratorSettings().splitThreshold()).isEqualTo(2500);
        assertThat(config.orchestratorSettings().failureCooldown()).isZero();
        assertThat(config.orchestratorSettings().progressInterval()).isEqualTo(5);
        assertThat(config.autoConfirm()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_SUPABASE_URL, ConfigLoader.ENV_MAX_ATTEMPTS);
    }

    @Test
    void cliArgumentsOverrideEnvironment() {
        Map<String, String> envValues = storeEnv();
        envValues.put(ConfigLoader.ENV_TRANSLATION_PROVIDER, "gemini");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "mock");
        envValues.put(ConfigLoader.ENV_SOURCE_FILE, "env.xml");
        envValues.put(ConfigLoader.ENV_CHUNK_SIZE, "800");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "ingest", "--source", "cli.xml", "--chunk-size", "1200", "--batch-size", "50",
                "--provider", "google", "--translation-mode", "production");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(envValues)).load(cliArguments);

        assertThat(config.sourceFile()).contains(Path.of("cli.xml"));
        assertThat(config.chunkSize()).isEqualTo(1200);
        assertThat(config.uploadBatchSize()).isEqualTo(50);
        assertThat(config.translatorConfig().provider()).isEqualTo(TranslationProvider.GOOGLE);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
    }

    @Test
    void schemaAndDryRunIngestNeedNoStoreCredentials() {
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        Config schema = loader.load(CommandLine.populateCommand(new CliArguments(), "schema"));
        Config dryRun = loader.load(CommandLine.populateCommand(new CliArguments(),
                "ingest", "--source", "book.xml", "--dry-run"));

        assertThat(schema.store().url()).isEmpty();
        assertThat(schema.store().schema().ddl()).contains("shiv_puran_chunks");
        assertThat(dryRun.dryRun()).isTrue();
        assertThat(dryRun.sourceFile()).contains(Path.of("book.xml"));
    }

    @Test
    void failsWhenStoreCredentialsAreMissing() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_SUPABASE_URL, "https://project.supabase.co");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(envValues))
                .load(CommandLine.populateCommand(new CliArguments(), "verify")));

        assertThat(thrown)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("SUPABASE_KEY")
                .hasMessageContaining("verify");
    }

    @Test
    void failsWhenIngestHasNoSource() {
        Throwable thrown = catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(storeEnv()))
                .load(CommandLine.populateCommand(new CliArguments(), "ingest")));

        assertThat(thrown)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("SOURCE_FILE");
    }

    @Test
    void failsWhenGeminiKeyIsMissingForProductionRun() {
        Map<String, String> envValues = storeEnv();
        envValues.put(ConfigLoader.ENV_TRANSLATION_PROVIDER, "gemini");
        ConfigLoader loader = new ConfigLoader(new RecordingEnvironmentReader(envValues));

        Throwable thrown = catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(), "translate")));
        Config mock = loader.load(CommandLine.populateCommand(new CliArguments(),
                "translate", "--translation-mode", "mock"));

        assertThat(thrown)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GEMINI_API_KEY");
        assertThat(mock.translatorConfig().provider()).isEqualTo(TranslationProvider.GEMINI);
    }

    @Test
    void rejectsInvalidRanges() {
        ConfigLoader loader = new ConfigLoader(new RecordingEnvironmentReader(storeEnv()));

        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "translate", "--start", "0"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("--start");
        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "translate", "--start", "10", "--end", "5"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("--end");
        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "translate", "--limit", "-1"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("--limit");
    }

    @Test
    void rejectsMalformedEnvironmentValues() {
        Map<String, String> badNumber = storeEnv();
        badNumber.put(ConfigLoader.ENV_MAX_ATTEMPTS, "many");
        Map<String, String> badTable = storeEnv();
        badTable.put(ConfigLoader.ENV_CHUNK_TABLE, "chunks; drop table chunks");
        Map<String, String> zeroAttempts = storeEnv();
        zeroAttempts.put(ConfigLoader.ENV_MAX_ATTEMPTS, "0");
        CliArguments translate = CommandLine.populateCommand(new CliArguments(), "translate");

        assertThat(catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(badNumber)).load(translate)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MAX_ATTEMPTS must be an integer");
        assertThat(catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(badTable)).load(translate)))
                .isInstanceOf(ConfigurationException.class);
        assertThat(catchThrowable(() -> new ConfigLoader(new RecordingEnvironmentReader(zeroAttempts)).load(translate)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test
    void secretsAreMaskedInToString() {
        Config config = new ConfigLoader(new RecordingEnvironmentReader(storeEnv()))
                .load(CommandLine.populateCommand(new CliArguments(), "verify"));

        assertThat(config.toString()).doesNotContain("service-key").contains("supabaseKey=***");
    }

    private static Map<String, String> storeEnv() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_SUPABASE_URL, "https://project.supabase.co");
        envValues.put(ConfigLoader.ENV_SUPABASE_KEY, "service-key");
        return envValues;
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
