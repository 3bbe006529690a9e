package ai.scripture.translator.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DtbookReaderTest {

    private static final String SAMPLE = """
            <?xml version="1.0" encoding="UTF-8"?>
            <dtbook xmlns="http://www.daisy.org/z3986/2005/dtbook/" version="2005-3">
              <book>
                <frontmatter><doctitle>शिव पुराण</doctitle></frontmatter>
                <bodymatter>
                  <level1>
                    <h1>विद्येश्वर संहिता</h1>
                    <p>पहला <em>अध्याय</em> आरम्भ।</p>
                    <level2>
                      <h3>Chapter <span>2</span></h3>
                      <p>दूसरा अनुच्छेद॥</p>
                    </level2>
                  </level1>
                </bodymatter>
              </book>
            </dtbook>
            """;

    private final DtbookReader reader = new DtbookReader();

    @Test
    void emitsHeadingsAndParagraphsInReadingOrder() {
        List<DocumentEvent> events = reader.read(stream(SAMPLE));

        assertThat(events).containsExactly(
                DocumentEvent.heading("विद्येश्वर संहिता"),
                DocumentEvent.paragraph("पहला अध्याय आरम्भ।"),
                DocumentEvent.heading("Chapter 2"),
                DocumentEvent.paragraph("दूसरा अनुच्छेद॥"));
    }

    @Test
    void readsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("book.xml");
        Files.writeString(file, SAMPLE, StandardCharsets.UTF_8);

        assertThat(reader.read(file)).hasSize(4);
    }

    @Test
    void missingFileIsSourceFormatError(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("absent.xml")))
                .isInstanceOf(SourceFormatException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedXmlIsSourceFormatError() {
        assertThatThrownBy(() -> reader.read(stream("<dtbook><p>unclosed</dtbook>")))
                .isInstanceOf(SourceFormatException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void feedsAssemblerEndToEnd() {
        ChunkAssembler assembler = new ChunkAssembler(1000);

        assertThat(assembler.assemble(reader.read(stream(SAMPLE))))
                .singleElement()
                .satisfies(chunk -> {
                    assertThat(chunk.section()).isEqualTo("Chapter 2");
                    assertThat(chunk.content()).isEqualTo("पहला अध्याय आरम्भ।\nदूसरा अनुच्छेद॥");
                });
    }

    private static ByteArrayInputStream stream(String xml) {
        return new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
    }
}
