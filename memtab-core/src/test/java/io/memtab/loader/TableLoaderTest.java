package io.memtab.loader;

import io.memtab.core.LoaderConfiguration;
import io.memtab.core.LoaderConfiguration.FieldExtraction;
import io.memtab.core.LoaderConfiguration.MalformedRecordPolicy;
import io.memtab.core.converter.FieldParser;
import io.memtab.logging.RecordingLogger;
import io.memtab.storage.SchemaTable;
import io.memtab.storage.TableSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.event.Level;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableLoaderTest {

    record Pair(String left, String right) {
    }

    record Triple(String a, String b, String c) {
    }

    record Line(String text) {
    }

    record Reading(String sensor, int value, double level) {
    }

    record Item(String name, int quantity, BigDecimal price) {
    }

    record Count(String name, int count) {
    }

    record Point(int x, int y) {
    }

    record Release(String title, LocalDate date, Locale locale) {
    }

    record Opaque(String name, Object payload) {
    }

    @TempDir
    Path tempDir;

    @BeforeEach
    void clearLogs() {
        RecordingLogger.clear();
    }

    private static TableLoader loader() {
        return new TableLoader(LoaderConfiguration.defaults());
    }

    private static TableLoader skipping() {
        return new TableLoader(LoaderConfiguration.builder()
                .malformedRecordPolicy(MalformedRecordPolicy.SKIP)
                .build());
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("data.txt");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Should load two textual columns in insertion order")
    void shouldLoadTextualPairs() throws IOException {
        Path file = write("a,b\nc,d\n");

        SchemaTable<Pair> table = TableLoader.load(file, ',', TableSpec.unordered("pairs", Pair.class));

        assertThat(table.rows()).containsExactly(new Pair("a", "b"), new Pair("c", "d"));
    }

    @Test
    @DisplayName("Should produce one row per record with fields split at the delimiter")
    void shouldRoundTripTextualRecords() throws IOException {
        List<Triple> expected = new ArrayList<>();
        StringBuilder content = new StringBuilder();
        for (var i = 0; i < 25; i++) {
            expected.add(new Triple("a" + i, "b b" + i, "c" + i));
            content.append("a").append(i).append('|').append("b b").append(i).append('|').append("c").append(i).append('\n');
        }

        SchemaTable<Triple> table = TableLoader.load(write(content.toString()), '|',
                TableSpec.unordered("triples", Triple.class));

        assertThat(table.rowCount()).isEqualTo(25);
        assertThat(table.rows()).containsExactlyElementsOf(expected);
    }

    @Test
    @DisplayName("Should return an empty table for an empty source")
    void shouldLoadEmptySource() throws IOException {
        SchemaTable<Pair> table = TableLoader.load(write(""), ',', TableSpec.unordered("pairs", Pair.class));

        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should read each whole line into a single textual column")
    void shouldReadWholeLinesForSingleTextColumn() {
        SchemaTable<Line> table = loader().load(new StringReader("a,b,c\n  spaced  \n\nlast"),
                TableSpec.unordered("lines", Line.class));

        assertThat(table.rows()).extracting(Line::text).containsExactly("a,b,c", "  spaced  ", "", "last");
    }

    @Test
    @DisplayName("Should keep delimiters inside the last textual column")
    void shouldKeepDelimitersInLastColumn() {
        SchemaTable<Pair> table = loader().load(new StringReader("1,hello, world,again\n"),
                TableSpec.unordered("pairs", Pair.class));

        assertThat(table.rows()).containsExactly(new Pair("1", "hello, world,again"));
    }

    @Test
    @DisplayName("Should accept a final record without line terminator and CRLF line ends")
    void shouldHandleLineEndings() {
        SchemaTable<Pair> table = loader().load(new StringReader("a,b\r\nc,d\r\ne,f"),
                TableSpec.unordered("pairs", Pair.class));

        assertThat(table.rows()).containsExactly(new Pair("a", "b"), new Pair("c", "d"), new Pair("e", "f"));
    }

    @Test
    @DisplayName("Should skip blank lines between multi-column records")
    void shouldSkipBlankLines() {
        SchemaTable<Pair> table = loader().load(new StringReader("a,b\n\nc,d\n\r\n"),
                TableSpec.unordered("pairs", Pair.class));

        assertThat(table.rows()).containsExactly(new Pair("a", "b"), new Pair("c", "d"));
    }

    @Test
    @DisplayName("Should skip lines holding only spaces and tabs, including a trailing one")
    void shouldSkipWhitespaceOnlyLines() {
        TableLoader spaced = new TableLoader(LoaderConfiguration.withDelimiter(' '));

        SchemaTable<Point> between = spaced.load(new StringReader("1 2\n   \n3 4\n"),
                TableSpec.unordered("points", Point.class));
        SchemaTable<Point> trailing = spaced.load(new StringReader("1 2\n3 4\n \t "),
                TableSpec.unordered("points", Point.class));
        SchemaTable<Pair> textual = loader().load(new StringReader("a,b\n\t \r\nc,d\n"),
                TableSpec.unordered("pairs", Pair.class));

        assertThat(between.rows()).containsExactly(new Point(1, 2), new Point(3, 4));
        assertThat(trailing.rows()).containsExactly(new Point(1, 2), new Point(3, 4));
        assertThat(textual.rows()).containsExactly(new Pair("a", "b"), new Pair("c", "d"));
    }

    @Test
    @DisplayName("Should parse non-textual columns as tokens")
    void shouldParseTokens() {
        SchemaTable<Reading> table = loader().load(new StringReader("s1,10,2.5\ns2, 20 , 3.75 \r\n"),
                TableSpec.unordered("readings", Reading.class));

        assertThat(table.rows()).containsExactly(new Reading("s1", 10, 2.5), new Reading("s2", 20, 3.75));
    }

    @Test
    @DisplayName("Should start the next record after the last token when the line continues")
    void shouldContinueRecordsOnTheSameLine() {
        SchemaTable<Point> table = loader().load(new StringReader("1 2 3 4\n5 6\n"),
                TableSpec.unordered("points", Point.class));

        assertThat(table.rows()).containsExactly(new Point(1, 2), new Point(3, 4), new Point(5, 6));
    }

    @Test
    @DisplayName("Should cut every field at the delimiter in delimited mode")
    void shouldSplitUniformlyInDelimitedMode() {
        TableLoader loader = new TableLoader(LoaderConfiguration.builder()
                .delimiter(';')
                .fieldExtraction(FieldExtraction.DELIMITED)
                .build());

        SchemaTable<Item> table = loader.load(new StringReader("bolt; 12 ; 0.25\nnut;100;0.05\n"),
                TableSpec.unordered("items", Item.class));

        assertThat(table.rows()).containsExactly(
                new Item("bolt", 12, new BigDecimal("0.25")),
                new Item("nut", 100, new BigDecimal("0.05")));
    }

    @Test
    @DisplayName("Should sort loaded rows for a keyed table")
    void shouldSortKeyedTable() {
        SchemaTable<Count> table = loader().load(new StringReader("c,3\na,1\nb,2\nd,1\n"),
                TableSpec.keyedBy("counts", Count.class, "count"));

        assertThat(table.rows()).extracting(Count::count).containsExactly(1, 1, 2, 3);
        assertThat(table.rowCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should use parsers registered in the configuration")
    void shouldUseConfiguredParsers() {
        TableLoader loader = new TableLoader(LoaderConfiguration.builder()
                .parser(FieldParser.of(Locale.class, Locale::forLanguageTag))
                .build());

        SchemaTable<Release> table = loader.load(new StringReader("Blue,2024-05-01,fr-CA\n"),
                TableSpec.unordered("releases", Release.class));

        assertThat(table.rows()).containsExactly(
                new Release("Blue", LocalDate.of(2024, 5, 1), Locale.forLanguageTag("fr-CA")));
    }

    @Test
    @DisplayName("Should reject a layout with a column type that has no parser")
    void shouldRejectUnsupportedColumnType() {
        assertThatThrownBy(() -> loader().load(new StringReader("a,b\n"), TableSpec.unordered("o", Opaque.class)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no parser for column 'payload'");
    }

    @Test
    @DisplayName("Should fail on an unparsable field with line and column")
    void shouldFailOnUnparsableField() {
        assertThatThrownBy(() -> loader().load(new StringReader("a,1\nb,x\nc,3\n"),
                TableSpec.unordered("counts", Count.class)))
                .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                    assertThat(e.line()).isEqualTo(2);
                    assertThat(e.column()).isEqualTo("count");
                    assertThat(e).hasMessage("line 2, column 'count': Cannot parse 'x' as Integer");
                });
    }

    @Test
    @DisplayName("Should fail on a record with too few fields")
    void shouldFailOnMissingField() {
        assertThatThrownBy(() -> loader().load(new StringReader("x,y,z\nx,y\n"),
                TableSpec.unordered("triples", Triple.class)))
                .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                    assertThat(e.line()).isEqualTo(2);
                    assertThat(e.column()).isEqualTo("b");
                    assertThat(e).hasMessageContaining("missing field");
                });
    }

    @Test
    @DisplayName("Should fail on an incomplete trailing record")
    void shouldFailOnIncompleteTrailingRecord() {
        assertThatThrownBy(() -> loader().load(new StringReader("x,y,z\nq"),
                TableSpec.unordered("triples", Triple.class)))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessage("line 2, column 'a': input ended inside record");
    }

    @Test
    @DisplayName("Should skip malformed records and log a warning for each")
    void shouldSkipMalformedRecords() {
        SchemaTable<Count> table = skipping().load(new StringReader("a,1\nb,x\nc,3\nd\ne,5"),
                TableSpec.unordered("counts", Count.class));

        assertThat(table.rows()).containsExactly(new Count("a", 1), new Count("c", 3), new Count("e", 5));
        assertThat(RecordingLogger.events(TableLoader.class, Level.WARN))
                .extracting(RecordingLogger.Event::message)
                .containsExactly(
                        "Skipping malformed record in reader: line 2, column 'count': Cannot parse 'x' as Integer",
                        "Skipping malformed record in reader: line 4, column 'name': missing field");
    }

    @Test
    @DisplayName("Should not skip the following line when the failing field ended its own line")
    void shouldResumeAfterFailedLastField() {
        TableLoader loader = new TableLoader(LoaderConfiguration.builder()
                .fieldExtraction(FieldExtraction.DELIMITED)
                .malformedRecordPolicy(MalformedRecordPolicy.SKIP)
                .build());

        SchemaTable<Count> table = loader.load(new StringReader("a,one\nb,2\n"),
                TableSpec.unordered("counts", Count.class));

        assertThat(table.rows()).containsExactly(new Count("b", 2));
    }

    @Test
    @DisplayName("Should drop an incomplete trailing record when skipping")
    void shouldDropIncompleteTrailingRecordWhenSkipping() {
        SchemaTable<Triple> table = skipping().load(new StringReader("x,y,z\nq,r"),
                TableSpec.unordered("triples", Triple.class));

        assertThat(table.rows()).containsExactly(new Triple("x", "y", "z"));
        assertThat(RecordingLogger.events(TableLoader.class, Level.WARN)).hasSize(1);
    }

    @Test
    @DisplayName("Should leave an existing table untouched when loading into it fails")
    void loadIntoShouldBeAllOrNothing() {
        SchemaTable<Count> table = TableSpec.unordered("counts", Count.class).newTable();
        table.emplace("seed", 0);

        assertThatThrownBy(() -> loader().loadInto(new StringReader("a,1\nb,oops\n"), table))
                .isInstanceOf(MalformedRecordException.class);
        assertThat(table.rows()).containsExactly(new Count("seed", 0));

        int inserted = loader().loadInto(new StringReader("a,1\nb,2\n"), table);

        assertThat(inserted).isEqualTo(2);
        assertThat(table.rows()).containsExactly(new Count("seed", 0), new Count("a", 1), new Count("b", 2));
    }

    @Test
    @DisplayName("Should report a missing source as a source failure")
    void shouldFailOnMissingFile() {
        Path missing = tempDir.resolve("missing.csv");

        assertThatThrownBy(() -> TableLoader.load(missing, ',', TableSpec.unordered("pairs", Pair.class)))
                .isInstanceOf(TableSourceException.class)
                .hasMessageContaining("Cannot read")
                .hasCauseInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("Should report a failing reader as a source failure")
    void shouldFailOnReadError() {
        Reader broken = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> loader().load(broken, TableSpec.unordered("pairs", Pair.class)))
                .isInstanceOf(TableSourceException.class)
                .hasRootCauseMessage("disk gone");
    }

    @Test
    @DisplayName("Should decode the file with the configured charset")
    void shouldUseConfiguredCharset() throws IOException {
        Path file = tempDir.resolve("latin1.txt");
        Files.writeString(file, "café,crème\n", StandardCharsets.ISO_8859_1);
        TableLoader loader = new TableLoader(LoaderConfiguration.builder()
                .charset(StandardCharsets.ISO_8859_1)
                .build());

        SchemaTable<Pair> table = loader.load(file, TableSpec.unordered("pairs", Pair.class));

        assertThat(table.rows()).containsExactly(new Pair("café", "crème"));
    }

    @Test
    @DisplayName("Should log the outcome of a load at debug level")
    void shouldLogLoadOutcome() throws IOException {
        TableLoader.load(write("a,b\nc,d\n"), ',', TableSpec.unordered("pairs", Pair.class));

        assertThat(RecordingLogger.events(TableLoader.class, Level.DEBUG))
                .extracting(RecordingLogger.Event::message)
                .anySatisfy(message -> assertThat(message).startsWith("Loaded 2 rows into table pairs from "));
    }

    @Test
    @DisplayName("Should reject missing arguments")
    void shouldRejectMissingArguments() {
        assertThatThrownBy(() -> new TableLoader(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("configuration required");
        assertThatThrownBy(() -> loader().load((Path) null, TableSpec.unordered("pairs", Pair.class)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("source required");
        assertThatThrownBy(() -> loader().load(new StringReader(""), (TableSpec<Pair>) null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spec required");
    }
}
