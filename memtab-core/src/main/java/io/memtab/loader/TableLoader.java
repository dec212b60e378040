package io.memtab.loader;

import io.memtab.core.LoaderConfiguration;
import io.memtab.core.LoaderConfiguration.FieldExtraction;
import io.memtab.core.LoaderConfiguration.MalformedRecordPolicy;
import io.memtab.core.converter.FieldParser;
import io.memtab.kernel.Column;
import io.memtab.kernel.RowLayout;
import io.memtab.kernel.Table;
import io.memtab.storage.SchemaTable;
import io.memtab.storage.TableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Bulk loader: reads delimited text and inserts one row per record.
 * <p>
 * Fields are filled in layout order. A textual column reads up to the delimiter, except the
 * last column, which takes the rest of the line verbatim. Non-textual columns are read as
 * described by {@link FieldExtraction} and parsed by the configured
 * {@link io.memtab.core.converter.FieldParser}. Rows become visible in the table only once
 * the whole source has been read.
 */
public final class TableLoader {
    private static final Logger log = LoggerFactory.getLogger(TableLoader.class);

    private final LoaderConfiguration configuration;

    public TableLoader(LoaderConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    /**
     * Load a file into a new table using the default configuration and the given delimiter.
     *
     * @throws TableSourceException     if the file cannot be opened or read
     * @throws MalformedRecordException if a record does not match the row layout
     */
    public static <R extends Record> SchemaTable<R> load(Path source, char delimiter, TableSpec<R> spec) {
        return new TableLoader(LoaderConfiguration.withDelimiter(delimiter)).load(source, spec);
    }

    public <R extends Record> SchemaTable<R> load(Path source, TableSpec<R> spec) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        var table = requireSpec(spec).newTable();
        try (var reader = Files.newBufferedReader(source, configuration.charset())) {
            read(reader, table, source.toString());
        } catch (IOException e) {
            throw new TableSourceException("Cannot read " + source, e);
        }
        return table;
    }

    /**
     * Load from an open reader. The reader is not closed; it belongs to the caller.
     */
    public <R extends Record> SchemaTable<R> load(Reader source, TableSpec<R> spec) {
        var table = requireSpec(spec).newTable();
        loadInto(source, table);
        return table;
    }

    /**
     * Append the records of an open reader to an existing table.
     * Nothing is inserted if the load fails.
     *
     * @return the number of rows inserted
     */
    public <R extends Record> int loadInto(Reader source, Table<R> table) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        try {
            return read(source, table, "reader");
        } catch (IOException e) {
            throw new TableSourceException("Cannot read source of table " + table.name(), e);
        }
    }

    private <R extends Record> int read(Reader source, Table<R> table, String sourceName) throws IOException {
        var layout = table.layout();
        var extractors = extractors(layout);
        var parsers = parsers(layout);
        var lastColumnOpen = !layout.lastColumn().isTextual()
                && configuration.fieldExtraction() == FieldExtraction.TOKEN;
        var blankLinesAreRecords = layout.arity() == 1 && layout.lastColumn().isTextual();

        log.debug("Loading table {} from {} (delimiter '{}', {} extraction)",
                table.name(), sourceName, configuration.delimiter(), configuration.fieldExtraction());

        var reader = new RecordReader(source);
        var rows = new ArrayList<R>();
        var skipped = 0;
        while (!reader.atEnd()) {
            if (!blankLinesAreRecords && reader.atBlankLine()) {
                reader.skipLine();
                continue;
            }
            int line = reader.line();
            try {
                rows.add(readRecord(reader, layout, extractors, parsers, lastColumnOpen, line));
            } catch (MalformedRecordException e) {
                if (configuration.malformedRecordPolicy() == MalformedRecordPolicy.FAIL) {
                    throw e;
                }
                skipped++;
                log.warn("Skipping malformed record in {}: {}", sourceName, e.getMessage());
                if (reader.line() == line) {
                    reader.skipLine();
                }
            }
        }

        for (R row : rows) {
            table.insert(row);
        }
        log.debug("Loaded {} rows into table {} from {} ({} skipped)", rows.size(), table.name(), sourceName, skipped);
        return rows.size();
    }

    private static <R extends Record> R readRecord(RecordReader reader, RowLayout<R> layout,
                                                   FieldExtractor[] extractors, FieldParser<?>[] parsers,
                                                   boolean lastColumnOpen, int line) throws IOException {
        var values = new Object[layout.arity()];
        for (var i = 0; i < values.length; i++) {
            Column<?> column = layout.column(i);
            String text = extractors[i].extract(reader);
            if (text == null) {
                throw new MalformedRecordException(line, column.name(),
                        reader.atEnd() ? "input ended inside record" : "missing field");
            }
            try {
                values[i] = parsers[i].parse(text);
            } catch (IllegalArgumentException e) {
                throw new MalformedRecordException(line, column.name(), e.getMessage(), e);
            }
        }
        if (lastColumnOpen) {
            // Token extraction leaves the line terminator unread.
            reader.finishRecord(true);
        }
        try {
            return layout.newRow(values);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(line, null, e.getMessage(), e);
        }
    }

    private FieldExtractor[] extractors(RowLayout<?> layout) {
        var delimiter = configuration.delimiter();
        var delimited = configuration.fieldExtraction() == FieldExtraction.DELIMITED;
        var extractors = new FieldExtractor[layout.arity()];
        for (Column<?> column : layout.columns()) {
            FieldExtractor extractor;
            boolean last = layout.isLast(column);
            if (column.isTextual()) {
                extractor = last ? RecordReader::readRestOfLine : reader -> reader.readUntil(delimiter);
            } else if (delimited) {
                extractor = last
                        ? reader -> trim(reader.readRestOfLine())
                        : reader -> trim(reader.readUntil(delimiter));
            } else {
                extractor = reader -> reader.readToken(delimiter);
            }
            extractors[column.position()] = extractor;
        }
        return extractors;
    }

    private FieldParser<?>[] parsers(RowLayout<?> layout) {
        var registry = configuration.parsers();
        var parsers = new FieldParser<?>[layout.arity()];
        for (Column<?> column : layout.columns()) {
            var parser = registry.getParser(column.type());
            if (parser == null) {
                throw new IllegalArgumentException("no parser for column '" + column.name() + "' of type "
                        + column.type().getName());
            }
            parsers[column.position()] = parser;
        }
        return parsers;
    }

    private static <R extends Record> TableSpec<R> requireSpec(TableSpec<R> spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec required");
        }
        return spec;
    }

    private static String trim(String text) {
        return text == null ? null : text.strip();
    }

    @FunctionalInterface
    private interface FieldExtractor {
        String extract(RecordReader reader) throws IOException;
    }
}
