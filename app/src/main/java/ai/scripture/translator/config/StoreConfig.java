package ai.scripture.translator.config;

import ai.scripture.translator.store.ChunkTableSchema;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Location of the chunk table. The URL is optional because {@code schema} and dry-run ingests never connect.
 */
public record StoreConfig(Optional<URI> url, String table, String translationColumn) {

    public StoreConfig {
        url = url == null ? Optional.empty() : url;
        table = requireNonBlank(table, "table");
        translationColumn = requireNonBlank(translationColumn, "translationColumn");
        new ChunkTableSchema(table, translationColumn);
    }

    public ChunkTableSchema schema() {
        return new ChunkTableSchema(table, translationColumn);
    }

    public URI requireUrl() {
        return url.orElseThrow(() -> new ConfigurationException("SUPABASE_URL must be provided"));
    }

    private static String requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
