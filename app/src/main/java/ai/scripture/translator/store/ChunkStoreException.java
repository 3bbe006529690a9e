package ai.scripture.translator.store;

import java.util.OptionalInt;

/**
 * Runtime exception for I/O failures against the chunk store.
 */
public class ChunkStoreException extends RuntimeException {

    private final int statusCode;

    public ChunkStoreException(String message) {
        this(message, -1, null);
    }

    public ChunkStoreException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ChunkStoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
