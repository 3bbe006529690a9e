package ai.scripture.translator.ingest;

/**
 * Raised when the source document is missing, unreadable or malformed. Nothing is written to the store.
 */
public class SourceFormatException extends RuntimeException {

    public SourceFormatException(String message) {
        super(message);
    }

    public SourceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
