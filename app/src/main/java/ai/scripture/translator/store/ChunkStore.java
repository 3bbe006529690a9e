package ai.scripture.translator.store;

import java.util.List;

/**
 * Durable keyed storage for chunks and their translation state.
 *
 * <p>Every method that touches the backing store throws {@link ChunkStoreException} on failure.
 * Updates are keyed by {@code chunk_id} and never span more than one row.
 */
public interface ChunkStore {

    /**
     * Verifies the chunk table is reachable before any bulk work starts.
     */
    void probe();

    /**
     * Inserts one batch of chunks. Callers are responsible for keeping batches within payload limits.
     */
    void insert(List<Chunk> batch);

    /**
     * Returns chunks in {@code range} whose translation is null, ordered by {@code chunk_id}.
     *
     * @param limit maximum number of rows, or {@code 0} for no limit
     */
    List<Chunk> findUntranslated(ChunkRange range, int limit);

    void updateTranslation(long chunkId, String translation);

    long count(ChunkRange range, TranslationState state);
}
