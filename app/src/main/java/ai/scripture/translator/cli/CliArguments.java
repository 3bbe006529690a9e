package ai.scripture.translator.cli;

import ai.scripture.translator.config.Command;
import ai.scripture.translator.config.LogFormat;
import ai.scripture.translator.config.TranslationProvider;
import ai.scripture.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "scripture-translator", mixinStandardHelpOptions = true,
        version = "scripture-translator 1.0.0",
        description = "Chunks a DTBook scripture into a Supabase table and translates it chunk by chunk")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "COMMAND", converter = CommandConverter.class,
            description = "One of: ingest, translate, verify, schema")
    private Command command;

    @CommandLine.Option(names = "--source", description = "DTBook XML file to ingest", paramLabel = "FILE")
    private Path sourceFile;

    @CommandLine.Option(names = "--chunk-size", description = "Maximum characters per chunk (default 1000)", paramLabel = "CHARS")
    private Integer chunkSize;

    @CommandLine.Option(names = "--batch-size", description = "Rows per insert batch (default 100)", paramLabel = "ROWS")
    private Integer batchSize;

    @CommandLine.Option(names = "--start", description = "First chunk id to process (default 1)", paramLabel = "ID")
    private Long start;

    @CommandLine.Option(names = "--end", description = "Last chunk id to process (default: no upper bound)", paramLabel = "ID")
    private Long end;

    @CommandLine.Option(names = "--limit", description = "Maximum number of chunks to translate in this run", paramLabel = "COUNT")
    private Integer limit;

    @CommandLine.Option(names = "--dry-run", description = "Preview the work without writing to the store")
    private boolean dryRun;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Skip the confirmation prompt")
    private boolean autoConfirm;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--provider", description = "Translation provider: google, ollama or gemini", converter = TranslationProviderConverter.class)
    private TranslationProvider provider;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public Command command() {
        return command;
    }

    public Path sourceFile() {
        return sourceFile;
    }

    public Integer chunkSize() {
        return chunkSize;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public Long start() {
        return start;
    }

    public Long end() {
        return end;
    }

    public Integer limit() {
        return limit;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean autoConfirm() {
        return autoConfirm;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public TranslationProvider provider() {
        return provider;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
