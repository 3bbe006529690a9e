package ai.scripture.translator.config;

import ai.scripture.translator.cli.CliArguments;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.translate.TranslationMode;
import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SUPABASE_URL = "SUPABASE_URL";
    static final String ENV_SUPABASE_KEY = "SUPABASE_KEY";
    static final String ENV_CHUNK_TABLE = "CHUNK_TABLE";
    static final String ENV_TRANSLATION_COLUMN = "TRANSLATION_COLUMN";
    static final String ENV_SOURCE_FILE = "SOURCE_FILE";
    static final String ENV_CHUNK_SIZE = "CHUNK_SIZE";
    static final String ENV_UPLOAD_BATCH_SIZE = "UPLOAD_BATCH_SIZE";
    static final String ENV_TRANSLATION_PROVIDER = "TRANSLATION_PROVIDER";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_SOURCE_LANGUAGE = "SOURCE_LANGUAGE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_SPLIT_THRESHOLD = "SPLIT_THRESHOLD";
    static final String ENV_MAX_ATTEMPTS = "MAX_ATTEMPTS";
    static final String ENV_FAILURE_COOLDOWN_SECONDS = "FAILURE_COOLDOWN_SECONDS";
    static final String ENV_PROGRESS_INTERVAL = "PROGRESS_INTERVAL";
    static final String ENV_AUTO_CONFIRM = "AUTO_CONFIRM";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_TABLE = "shiv_puran_chunks";
    private static final String DEFAULT_TRANSLATION_COLUMN = "english_translation";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_SOURCE_LANGUAGE = "auto";
    private static final String DEFAULT_TARGET_LANGUAGE = "en";
    private static final int DEFAULT_CHUNK_SIZE = 1000;
    private static final int DEFAULT_UPLOAD_BATCH_SIZE = 100;
    private static final int DEFAULT_SPLIT_THRESHOLD = 4000;
    private static final int DEFAULT_MAX_ATTEMPTS = 5;
    private static final int DEFAULT_FAILURE_COOLDOWN_SECONDS = 10;
    private static final int DEFAULT_PROGRESS_INTERVAL = 20;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Command command = Objects.requireNonNull(arguments.command(), "command");
        boolean dryRun = arguments.dryRun();

        Optional<Path> sourceFile = Optional.ofNullable(arguments.sourceFile())
                .or(() -> env(ENV_SOURCE_FILE).map(Path::of));
        int chunkSize = Optional.ofNullable(arguments.chunkSize())
                .orElseGet(() -> envInt(ENV_CHUNK_SIZE, DEFAULT_CHUNK_SIZE));
        int uploadBatchSize = Optional.ofNullable(arguments.batchSize())
                .orElseGet(() -> envInt(ENV_UPLOAD_BATCH_SIZE, DEFAULT_UPLOAD_BATCH_SIZE));

        Optional<URI> storeUrl = env(ENV_SUPABASE_URL).map(ConfigLoader::parseUri);
        StoreConfig store = resolveStore(storeUrl);
        Secrets secrets = new Secrets(env(ENV_SUPABASE_KEY), env(ENV_GEMINI_API_KEY));

        ChunkRange range = resolveRange(arguments);
        int limit = resolveLimit(arguments);
        boolean autoConfirm = arguments.autoConfirm() || env(ENV_AUTO_CONFIRM).map(ConfigLoader::parseBoolean).orElse(false);
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        TranslatorConfig translatorConfig = resolveTranslator(arguments);

        int splitThreshold = envInt(ENV_SPLIT_THRESHOLD, DEFAULT_SPLIT_THRESHOLD);
        int maxAttempts = envInt(ENV_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
        int failureCooldownSeconds = envInt(ENV_FAILURE_COOLDOWN_SECONDS, DEFAULT_FAILURE_COOLDOWN_SECONDS);
        int progressInterval = envInt(ENV_PROGRESS_INTERVAL, DEFAULT_PROGRESS_INTERVAL);

        validateRequirements(command, dryRun, sourceFile, store, secrets, translationMode, translatorConfig);

        try {
            return new Config(command, sourceFile, chunkSize, uploadBatchSize, store, range, limit, dryRun,
                    autoConfirm, translationMode, logFormat, arguments.verbose(), translatorConfig, secrets,
                    splitThreshold, maxAttempts, failureCooldownSeconds, progressInterval);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
    }

    private void validateRequirements(Command command, boolean dryRun, Optional<Path> sourceFile, StoreConfig store,
                                      Secrets secrets, TranslationMode translationMode,
                                      TranslatorConfig translatorConfig) {
        if (command == Command.INGEST && sourceFile.isEmpty()) {
            throw new ConfigurationException("SOURCE_FILE or --source must be provided for ingest");
        }
        boolean needsStore = switch (command) {
            case INGEST -> !dryRun;
            case TRANSLATE, VERIFY -> true;
            case SCHEMA -> false;
        };
        if (needsStore && (store.url().isEmpty() || secrets.supabaseKey().isEmpty())) {
            throw new ConfigurationException("SUPABASE_URL and SUPABASE_KEY must be provided for "
                    + command.displayName());
        }
        if (command == Command.TRANSLATE
                && translationMode == TranslationMode.PRODUCTION
                && translatorConfig.provider() == TranslationProvider.GEMINI
                && secrets.geminiApiKey().isEmpty()) {
            throw new ConfigurationException("GEMINI_API_KEY must be provided when TRANSLATION_PROVIDER=gemini");
        }
    }

    private StoreConfig resolveStore(Optional<URI> storeUrl) {
        try {
            return new StoreConfig(storeUrl,
                    env(ENV_CHUNK_TABLE).orElse(DEFAULT_TABLE),
                    env(ENV_TRANSLATION_COLUMN).orElse(DEFAULT_TRANSLATION_COLUMN));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
    }

    private ChunkRange resolveRange(CliArguments arguments) {
        long start = arguments.start() == null ? 1 : arguments.start();
        if (start < 1) {
            throw new ConfigurationException("--start must be at least 1");
        }
        Long end = arguments.end();
        if (end != null && end < start) {
            throw new ConfigurationException("--end must be greater than or equal to --start");
        }
        return new ChunkRange(start, end == null ? OptionalLong.empty() : OptionalLong.of(end));
    }

    private int resolveLimit(CliArguments arguments) {
        Integer limit = arguments.limit();
        if (limit == null) {
            return 0;
        }
        if (limit < 0) {
            throw new ConfigurationException("--limit must be zero or greater");
        }
        return limit;
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_TRANSLATION_MODE)
                .map(ConfigLoader::parseTranslationMode)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(ConfigLoader::parseLogFormat)
                .orElse(LogFormat.TEXT);
    }

    private TranslatorConfig resolveTranslator(CliArguments arguments) {
        TranslationProvider provider = Optional.ofNullable(arguments.provider())
                .or(() -> env(ENV_TRANSLATION_PROVIDER).map(ConfigLoader::parseProvider))
                .orElse(TranslationProvider.GOOGLE);
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = Optional.empty();
        if (provider == TranslationProvider.OLLAMA) {
            baseUrl = Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        return new TranslatorConfig(provider, modelName, baseUrl,
                env(ENV_SOURCE_LANGUAGE).orElse(DEFAULT_SOURCE_LANGUAGE),
                env(ENV_TARGET_LANGUAGE).orElse(DEFAULT_TARGET_LANGUAGE));
    }

    private String defaultModelFor(TranslationProvider provider) {
        return switch (provider) {
            case GOOGLE -> "google-translate";
            case OLLAMA -> "llama3.1:8b";
            case GEMINI -> "gemini-1.5-flash";
        };
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank);
    }

    private int envInt(String key, int defaultValue) {
        return env(key).map(raw -> parseInteger(key, raw)).orElse(defaultValue);
    }

    private static int parseInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new ConfigurationException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(key + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        return value.equals("true") || value.equals("1") || value.equals("yes");
    }

    private static URI parseUri(String raw) {
        try {
            return URI.create(raw);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ENV_SUPABASE_URL + " is not a valid URL: " + raw, ex);
        }
    }

    private static TranslationMode parseTranslationMode(String raw) {
        try {
            return TranslationMode.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
    }

    private static LogFormat parseLogFormat(String raw) {
        try {
            return LogFormat.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
    }

    private static TranslationProvider parseProvider(String raw) {
        try {
            return TranslationProvider.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
