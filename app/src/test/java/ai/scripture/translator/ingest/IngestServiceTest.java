package ai.scripture.translator.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.scripture.translator.store.Chunk;
import ai.scripture.translator.store.ChunkStore;
import ai.scripture.translator.store.ChunkStoreException;
import ai.scripture.translator.store.ChunkTableSchema;
import ai.scripture.translator.store.InMemoryChunkStore;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestServiceTest {

    private static final String BOOK = """
            <dtbook>
              <h1>Introduction to the Purana</h1>
              <p>One.</p>
              <p>Two.</p>
              <h2>Chapter 1</h2>
              <p>Three is longer.</p>
            </dtbook>
            """;

    @TempDir
    Path dir;

    @Test
    void uploadsAssembledChunksAndReportsStoreCount() throws Exception {
        InMemoryChunkStore store = new InMemoryChunkStore();
        IngestService service = service(() -> store, 12);

        IngestService.IngestReport report = service.ingest(writeBook(), false);

        assertThat(report.chunkCount()).isEqualTo(2);
        assertThat(report.uploaded()).isEqualTo(2);
        assertThat(report.storeRowCount()).hasValue(2);
        assertThat(store.rows()).extracting(Chunk::content)
                .containsExactly("One.\nTwo.", "Three is longer.");
        assertThat(store.rows()).allSatisfy(chunk -> assertThat(chunk.translation()).isEmpty());
    }

    @Test
    void dryRunNeverResolvesStore() throws Exception {
        AtomicInteger lookups = new AtomicInteger();
        IngestService service = service(() -> {
            lookups.incrementAndGet();
            return new InMemoryChunkStore();
        }, 1000);

        IngestService.IngestReport report = service.ingest(writeBook(), true);

        assertThat(report.chunkCount()).isEqualTo(1);
        assertThat(report.uploaded()).isZero();
        assertThat(report.storeRowCount()).isEmpty();
        assertThat(lookups).hasValue(0);
    }

    @Test
    void inaccessibleTableAbortsBeforeUpload() throws Exception {
        InMemoryChunkStore store = new InMemoryChunkStore().failProbe();
        IngestService service = service(() -> store, 1000);
        Path book = writeBook();

        assertThatThrownBy(() -> service.ingest(book, false)).isInstanceOf(ChunkStoreException.class);
        assertThat(store.insertedBatches()).isEmpty();
    }

    @Test
    void malformedSourceFailsBeforeTouchingStore() throws Exception {
        AtomicInteger lookups = new AtomicInteger();
        IngestService service = service(() -> {
            lookups.incrementAndGet();
            return new InMemoryChunkStore();
        }, 1000);
        Path broken = dir.resolve("broken.xml");
        Files.writeString(broken, "<dtbook><p>oops</dtbook>", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.ingest(broken, false)).isInstanceOf(SourceFormatException.class);
        assertThat(lookups).hasValue(0);
    }

    private IngestService service(Supplier<ChunkStore> store, int chunkSize) {
        return new IngestService(new DtbookReader(), new ChunkAssembler(chunkSize),
                new ChunkTableSchema("chunks", "english_translation"), store, 100);
    }

    private Path writeBook() throws Exception {
        Path file = dir.resolve("book.xml");
        Files.writeString(file, BOOK, StandardCharsets.UTF_8);
        return file;
    }
}
