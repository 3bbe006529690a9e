package ai.scripture.translator.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads environment variables from the host system, falling back to a {@code .env} file when one exists.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemEnvironmentReader.class);
    public static final Path DEFAULT_DOTENV = Path.of(".env");

    private final Function<String, String> processEnvironment;
    private final Map<String, String> dotenv;

    public SystemEnvironmentReader() {
        this(System::getenv, DEFAULT_DOTENV);
    }

    SystemEnvironmentReader(Function<String, String> processEnvironment, Path dotenvFile) {
        this.processEnvironment = Objects.requireNonNull(processEnvironment, "processEnvironment");
        this.dotenv = loadDotenv(dotenvFile);
    }

    @Override
    public Optional<String> get(String key) {
        String value = processEnvironment.apply(key);
        if (value != null) {
            return Optional.of(value);
        }
        return Optional.ofNullable(dotenv.get(key));
    }

    static Map<String, String> parseDotenv(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).strip();
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).strip();
            String value = line.substring(separator + 1).strip();
            values.put(key, unquote(value));
        }
        return values;
    }

    private static Map<String, String> loadDotenv(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Map.of();
        }
        try {
            Map<String, String> values = parseDotenv(Files.readAllLines(file, StandardCharsets.UTF_8));
            LOGGER.debug("Loaded {} settings from {}", values.size(), file);
            return values;
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read " + file, ex);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        int comment = value.indexOf(" #");
        return comment >= 0 ? value.substring(0, comment).strip() : value;
    }
}
