package ai.scripture.translator.ingest;

import ai.scripture.translator.store.Chunk;
import ai.scripture.translator.store.ChunkStore;
import ai.scripture.translator.store.ChunkStoreException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk-writes assembled chunks in fixed-size batches. The first failing batch aborts the upload.
 */
public class ChunkUploader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkUploader.class);

    private final ChunkStore store;
    private final int batchSize;

    public ChunkUploader(ChunkStore store, int batchSize) {
        this.store = Objects.requireNonNull(store, "store");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
    }

    /**
     * @return number of chunks written
     * @throws ChunkStoreException from the first batch the store rejects
     */
    public int upload(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            LOGGER.info("No chunks to upload");
            return 0;
        }
        int totalBatches = (chunks.size() - 1) / batchSize + 1;
        LOGGER.info("Uploading {} chunks in {} batches", chunks.size(), totalBatches);
        int written = 0;
        for (int from = 0; from < chunks.size(); from += batchSize) {
            List<Chunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            int batchNumber = from / batchSize + 1;
            try {
                store.insert(batch);
            } catch (ChunkStoreException ex) {
                Chunk first = batch.get(0);
                LOGGER.error("Batch {}/{} failed: {}", batchNumber, totalBatches, ex.getMessage());
                LOGGER.error("First chunk in failed batch: id={} section='{}' content='{}'",
                        first.chunkId(), first.section(), first.preview(80));
                throw ex;
            }
            written += batch.size();
            LOGGER.info("Batch {}/{} uploaded ({} chunks)", batchNumber, totalBatches, batch.size());
        }
        return written;
    }
}
