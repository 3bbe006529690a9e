package ai.scripture.translator.store;

import java.util.OptionalLong;

/**
 * Inclusive {@code chunk_id} range; an absent end means "to the last chunk".
 */
public record ChunkRange(long start, OptionalLong end) {

    public ChunkRange {
        if (start < 1) {
            throw new IllegalArgumentException("start must be at least 1");
        }
        end = end == null ? OptionalLong.empty() : end;
        if (end.isPresent() && end.getAsLong() < start) {
            throw new IllegalArgumentException("end must not be before start");
        }
    }

    public static ChunkRange from(long start) {
        return new ChunkRange(start, OptionalLong.empty());
    }

    public static ChunkRange between(long start, long end) {
        return new ChunkRange(start, OptionalLong.of(end));
    }

    public static ChunkRange all() {
        return from(1);
    }

    public boolean contains(long chunkId) {
        return chunkId >= start && (end.isEmpty() || chunkId <= end.getAsLong());
    }

    @Override
    public String toString() {
        return end.isPresent() ? start + "-" + end.getAsLong() : start + "+";
    }
}
