package ai.scripture.translator.orchestrate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.scripture.translator.store.Chunk;
import ai.scripture.translator.store.ChunkRange;
import ai.scripture.translator.store.InMemoryChunkStore;
import org.junit.jupiter.api.Test;

class VerifierTest {

    @Test
    void countsRowsInRangeFromStore() {
        InMemoryChunkStore store = new InMemoryChunkStore(
                Chunk.of(1, "Intro", "पहला").withTranslation("first"),
                Chunk.of(2, "Intro", "दूसरा"),
                Chunk.of(3, "Intro", "तीसरा").withTranslation("[too short]"),
                Chunk.of(4, "Intro", "चौथा"),
                Chunk.of(9, "Later", "नौवां"));

        VerificationReport report = new Verifier(store).verify(ChunkRange.between(1, 4));

        assertThat(report.total()).isEqualTo(4);
        assertThat(report.translated()).isEqualTo(2);
        assertThat(report.untranslated()).isEqualTo(2);
        assertThat(report.percentTranslated()).isEqualTo(50.0);
        assertThat(report.complete()).isFalse();
    }

    @Test
    void emptyRangeIsCompleteAtZeroPercent() {
        VerificationReport report = new Verifier(new InMemoryChunkStore()).verify(ChunkRange.all());

        assertThat(report.total()).isZero();
        assertThat(report.percentTranslated()).isZero();
        assertThat(report.complete()).isTrue();
    }
}
