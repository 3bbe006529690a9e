package ai.scripture.translator.store;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Renders the DDL an operator runs once to create the chunk table.
 */
public final class ChunkTableSchema {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String table;
    private final String translationColumn;

    public ChunkTableSchema(String table, String translationColumn) {
        this.table = requireIdentifier(table, "table");
        this.translationColumn = requireIdentifier(translationColumn, "translationColumn");
    }

    public String ddl() {
        return """
                CREATE TABLE %1$s (
                    id BIGSERIAL PRIMARY KEY,
                    chunk_id INTEGER NOT NULL UNIQUE,
                    section TEXT,
                    content TEXT NOT NULL,
                    char_count INTEGER,
                    %2$s TEXT,
                    created_at TIMESTAMP WITH TIME ZONE DEFAULT NOW()
                );

                CREATE INDEX idx_%1$s_chunk_id ON %1$s(chunk_id);
                CREATE INDEX idx_%1$s_section ON %1$s(section);
                """.formatted(table, translationColumn);
    }

    static String requireIdentifier(String value, String field) {
        Objects.requireNonNull(value, field);
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " must be a plain SQL identifier: " + value);
        }
        return value;
    }
}
