package ai.scripture.translator.config;

/**
 * Raised when required settings are missing or invalid. Nothing has been read or written when it is thrown.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
