package ai.scripture.translator.ingest;

import ai.scripture.translator.store.Chunk;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.store.ChunkStore;
import ai.scripture.translator.store.ChunkStoreException;
import ai.scripture.translator.store.ChunkTableSchema;
import ai.scripture.translator.store.TranslationState;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the source document, assembles chunks and bulk-loads them into the chunk store.
 */
public class IngestService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestService.class);
    private static final int PREVIEW_CHUNKS = 2;
    private static final int PREVIEW_LENGTH = 150;

    private final DtbookReader reader;
    private final ChunkAssembler assembler;
    private final ChunkTableSchema schema;
    private final Supplier<ChunkStore> storeSupplier;
    private final int batchSize;

    /**
     * @param storeSupplier resolved only when chunks are actually uploaded
     */
    public IngestService(DtbookReader reader, ChunkAssembler assembler, ChunkTableSchema schema,
                         Supplier<ChunkStore> storeSupplier, int batchSize) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.storeSupplier = Objects.requireNonNull(storeSupplier, "storeSupplier");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    /**
     * @param dryRun when true, stops after assembling and previewing; the store is never contacted
     */
    public IngestReport ingest(Path source, boolean dryRun) {
        List<Chunk> chunks = assembler.assemble(reader.read(source));
        IngestReport report = IngestReport.assembled(chunks);
        LOGGER.info("Created {} chunks (budget {} chars, average {} chars, {} oversized)",
                report.chunkCount(), assembler.maxChunkSize(), Math.round(report.averageChunkSize()),
                countOversized(chunks));
        preview(chunks);

        if (dryRun) {
            LOGGER.info("Dry run: skipping upload of {} chunks", chunks.size());
            return report;
        }
        if (chunks.isEmpty()) {
            LOGGER.warn("Source document produced no content; nothing to upload");
            return report;
        }

        ChunkStore store = Objects.requireNonNull(storeSupplier.get(), "store");
        try {
            store.probe();
        } catch (ChunkStoreException ex) {
            LOGGER.error("Chunk table is not accessible: {}", ex.getMessage());
            LOGGER.error("Make sure the table exists, for example:\n{}", schema.ddl());
            throw ex;
        }

        int uploaded = new ChunkUploader(store, batchSize).upload(chunks);
        long rows = store.count(ChunkRange.all(), TranslationState.ANY);
        LOGGER.info("Uploaded {} chunks; store now holds {} rows", uploaded, rows);
        return report.withUpload(uploaded, rows);
    }

    private long countOversized(List<Chunk> chunks) {
        return chunks.stream().filter(chunk -> chunk.charCount() > assembler.maxChunkSize()).count();
    }

    private void preview(List<Chunk> chunks) {
        chunks.stream().limit(PREVIEW_CHUNKS).forEach(chunk ->
                LOGGER.info("Chunk {} (section: {}): {}", chunk.chunkId(), chunk.section(), chunk.preview(PREVIEW_LENGTH)));
    }

    /**
     * Summary of one ingest run; store figures are empty for dry runs.
     */
    public record IngestReport(int chunkCount, double averageChunkSize, int uploaded, OptionalLong storeRowCount) {

        public IngestReport {
            storeRowCount = storeRowCount == null ? OptionalLong.empty() : storeRowCount;
        }

        static IngestReport assembled(List<Chunk> chunks) {
            double average = chunks.stream().mapToInt(Chunk::charCount).average().orElse(0);
            return new IngestReport(chunks.size(), average, 0, OptionalLong.empty());
        }

        IngestReport withUpload(int uploadedChunks, long rows) {
            return new IngestReport(chunkCount, averageChunkSize, uploadedChunks, OptionalLong.of(rows));
        }
    }
}
