package ai.scripture.translator.config;

import java.util.Locale;

/**
 * Top-level operation selected on the command line.
 */
public enum Command {
    INGEST,
    TRANSLATE,
    VERIFY,
    SCHEMA;

    public static Command from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command must be provided");
        }
        for (Command command : values()) {
            if (command.name().equalsIgnoreCase(raw.trim())) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unsupported command: " + raw
                + " (expected one of ingest, translate, verify, schema)");
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
