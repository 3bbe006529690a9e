package ai.scripture.translator.cli;

import ai.scripture.translator.config.Config;
import ai.scripture.translator.config.ConfigLoader;
import ai.scripture.translator.config.ConfigurationException;
import ai.scripture.translator.config.Secrets;
import ai.scripture.translator.config.SystemEnvironmentReader;
import ai.scripture.translator.config.TranslatorConfig;
import ai.scripture.translator.ingest.ChunkAssembler;
import ai.scripture.translator.ingest.DtbookReader;
import ai.scripture.translator.ingest.IngestService;
import ai.scripture.translator.ingest.SourceFormatException;
import ai.scripture.translator.logging.LoggingConfigurator;
import ai.scripture.translator.orchestrate.ChunkClassifier;
import ai.scripture.translator.orchestrate.TranslationOrchestrator;
import ai.scripture.translator.orchestrate.Verifier;
import ai.scripture.translator.orchestrate.WorkPlan;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.store.ChunkStore;
import ai.scripture.translator.store.ChunkStoreException;
import ai.scripture.translator.store.SupabaseChunkStore;
import ai.scripture.translator.translate.ChatModelTranslationClient;
import ai.scripture.translator.translate.GoogleTranslateClient;
import ai.scripture.translator.translate.MockTranslationClient;
import ai.scripture.translator.translate.RetryingTranslator;
import ai.scripture.translator.translate.SentenceSplitter;
import ai.scripture.translator.translate.Sleeper;
import ai.scripture.translator.translate.TranslationClient;
import ai.scripture.translator.translate.TranslationClientFactory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and pipeline components.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION_ERROR = 1;
    static final int EXIT_SOURCE_ERROR = 2;
    static final int EXIT_STORE_ERROR = 3;
    static final int EXIT_CANCELLED = 130;

    private final ConfigLoader configLoader;
    private final Function<Config, ChunkStore> storeFactory;
    private final Function<Config, TranslationClient> productionClientFactory;
    private final ConfirmationPrompt confirmationPrompt;
    private final Sleeper sleeper;
    private final PrintStream stdout;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createStore,
                CliApplication::createProductionClient, ConfirmationPrompt.console(), Sleeper.system(), System.out);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChunkStore> storeFactory,
                   Function<Config, TranslationClient> productionClientFactory, ConfirmationPrompt confirmationPrompt,
                   Sleeper sleeper, PrintStream stdout) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
        this.productionClientFactory = Objects.requireNonNull(productionClientFactory, "productionClientFactory");
        this.confirmationPrompt = Objects.requireNonNull(confirmationPrompt, "confirmationPrompt");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stdout = Objects.requireNonNull(stdout, "stdout");
    }

    public static void main(String[] args) {
        ShutdownHook shutdownHook = new ShutdownHook(Thread.currentThread(), Duration.ofSeconds(30));
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook, "shutdown-interrupt"));

        int exitCode = new CliApplication().run(args);
        shutdownHook.markFinished();
        if (!shutdownHook.triggered()) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalStateException | IllegalArgumentException ex) {
            LOGGER.error("Configuration error: {}", ex.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Running {} with {}", config.command().displayName(), config);

        try {
            return switch (config.command()) {
                case SCHEMA -> printSchema(config);
                case INGEST -> ingest(config);
                case TRANSLATE -> translate(config);
                case VERIFY -> verify(config);
            };
        } catch (ConfigurationException ex) {
            LOGGER.error("Configuration error: {}", ex.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (SourceFormatException ex) {
            LOGGER.error("Cannot read source document: {}", ex.getMessage());
            return EXIT_SOURCE_ERROR;
        } catch (ChunkStoreException ex) {
            LOGGER.error("Chunk store error: {}", ex.getMessage(), ex);
            return EXIT_STORE_ERROR;
        }
    }

    private int printSchema(Config config) {
        stdout.println(config.store().schema().ddl());
        return EXIT_OK;
    }

    private int ingest(Config config) {
        Path source = config.sourceFile()
                .orElseThrow(() -> new ConfigurationException("SOURCE_FILE or --source must be provided for ingest"));
        LOGGER.info("Ingesting {} into table {} (chunk size {}, batch size {})",
                source, config.store().table(), config.chunkSize(), config.uploadBatchSize());
        IngestService service = new IngestService(new DtbookReader(), new ChunkAssembler(config.chunkSize()),
                config.store().schema(), () -> storeFactory.apply(config), config.uploadBatchSize());
        IngestService.IngestReport report = service.ingest(source, config.dryRun());
        LOGGER.info("Ingest finished: {} chunks assembled, {} uploaded", report.chunkCount(), report.uploaded());
        return EXIT_OK;
    }

    private int translate(Config config) {
        ChunkRange range = config.range();
        ChunkStore store = storeFactory.apply(config);
        TranslationClientFactory clients = new TranslationClientFactory(
                () -> productionClientFactory.apply(config), new MockTranslationClient());
        TranslationClient client = clients.select(config.translationMode());
        TranslatorConfig translatorConfig = config.translatorConfig();
        LOGGER.info("Translating chunks {} with {} ({}) in {} mode, writing to {}.{}", range,
                translatorConfig.provider(), translatorConfig.modelName(), config.translationMode(),
                config.store().table(), config.store().translationColumn());

        RetryingTranslator translator = new RetryingTranslator(client, config.retryPolicy(), sleeper, new Random());
        TranslationOrchestrator orchestrator = new TranslationOrchestrator(store, translator, new SentenceSplitter(),
                new ChunkClassifier(), config.orchestratorSettings(), sleeper, Clock.systemUTC());

        WorkPlan plan = orchestrator.plan(range, config.limit());
        if (plan.nothingPending()) {
            LOGGER.info("All chunks in range {} are already translated", range);
            orchestrator.verify(range);
            return EXIT_OK;
        }
        if (config.dryRun()) {
            LOGGER.info("Dry run: {} chunks would be translated", plan.pending());
            return EXIT_OK;
        }
        if (!config.autoConfirm()
                && !confirmationPrompt.confirm("Translate %d chunks in range %s?".formatted(plan.pending(), range))) {
            LOGGER.info("Translation cancelled by operator");
            return EXIT_CANCELLED;
        }

        TranslationOrchestrator.RunReport report = orchestrator.run(range, config.limit());
        return report.summary().interrupted() ? EXIT_CANCELLED : EXIT_OK;
    }

    private int verify(Config config) {
        new Verifier(storeFactory.apply(config)).verify(config.range());
        return EXIT_OK;
    }

    private static ChunkStore createStore(Config config) {
        String key = config.secrets().supabaseKey()
                .orElseThrow(() -> new ConfigurationException("SUPABASE_KEY must be provided"));
        return new SupabaseChunkStore(config.store().requireUrl(), key, config.store().table(),
                config.store().translationColumn());
    }

    private static TranslationClient createProductionClient(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return switch (translatorConfig.provider()) {
            case GOOGLE -> new GoogleTranslateClient(translatorConfig.sourceLanguage(), translatorConfig.targetLanguage());
            case OLLAMA -> chatClient(createOllamaChatModel(translatorConfig), "Ollama", translatorConfig);
            case GEMINI -> chatClient(createGeminiChatModel(translatorConfig, config.secrets()), "Gemini", translatorConfig);
        };
    }

    private static TranslationClient chatClient(ChatModel model, String providerName, TranslatorConfig translatorConfig) {
        return new ChatModelTranslationClient(model, providerName, translatorConfig.modelName(),
                translatorConfig.sourceLanguage(), translatorConfig.targetLanguage());
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        String baseUrl = translatorConfig.baseUrl()
                .orElseThrow(() -> new ConfigurationException("OLLAMA_BASE_URL must be configured when TRANSLATION_PROVIDER=ollama"));
        try {
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new ConfigurationException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new ConfigurationException("GEMINI_API_KEY must be provided when TRANSLATION_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new ConfigurationException("Failed to initialize Gemini chat model", ex);
        }
    }
}
