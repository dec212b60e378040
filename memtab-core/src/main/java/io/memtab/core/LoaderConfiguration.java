package io.memtab.core;

import io.memtab.core.converter.FieldParser;
import io.memtab.core.converter.FieldParserRegistry;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Immutable configuration for loading delimited text into a table.
 * <p>
 * Use the builder to override defaults:
 * <pre>
 * LoaderConfiguration config = LoaderConfiguration.builder()
 *     .delimiter('|')
 *     .malformedRecordPolicy(MalformedRecordPolicy.SKIP)
 *     .build();
 * </pre>
 */
public final class LoaderConfiguration {

    private final char delimiter;
    private final Charset charset;
    private final FieldExtraction fieldExtraction;
    private final MalformedRecordPolicy malformedRecordPolicy;
    private final FieldParserRegistry parsers;

    private LoaderConfiguration(Builder builder) {
        this.delimiter = builder.delimiter;
        this.charset = builder.charset;
        this.fieldExtraction = builder.fieldExtraction;
        this.malformedRecordPolicy = builder.malformedRecordPolicy;
        this.parsers = builder.parsers.copy();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configuration: comma delimiter, UTF-8, token extraction, fail on malformed records.
     */
    public static LoaderConfiguration defaults() {
        return builder().build();
    }

    /**
     * Defaults with a different delimiter.
     */
    public static LoaderConfiguration withDelimiter(char delimiter) {
        return builder().delimiter(delimiter).build();
    }

    public char delimiter() {
        return delimiter;
    }

    public Charset charset() {
        return charset;
    }

    public FieldExtraction fieldExtraction() {
        return fieldExtraction;
    }

    public MalformedRecordPolicy malformedRecordPolicy() {
        return malformedRecordPolicy;
    }

    /**
     * Copy of the parser registrations; changing it does not affect this configuration.
     */
    public FieldParserRegistry parsers() {
        return parsers.copy();
    }

    /**
     * How non-textual fields are cut out of the stream.
     */
    public enum FieldExtraction {
        /**
         * Skip spaces and tabs, then read a token up to whitespace, the delimiter or the line end.
         * Textual fields still honor the delimiter.
         */
        TOKEN,

        /**
         * Every field, textual or not, ends at the delimiter (or the line end for the last column);
         * non-textual fields are trimmed before parsing.
         */
        DELIMITED
    }

    /**
     * What to do with a record that cannot be read against the row layout.
     */
    public enum MalformedRecordPolicy {
        /** Abort the load with an exception naming the line and column. */
        FAIL,

        /** Drop the rest of the offending line, log a warning and continue. */
        SKIP
    }

    public static final class Builder {
        private char delimiter = ',';
        private Charset charset = StandardCharsets.UTF_8;
        private FieldExtraction fieldExtraction = FieldExtraction.TOKEN;
        private MalformedRecordPolicy malformedRecordPolicy = MalformedRecordPolicy.FAIL;
        private final FieldParserRegistry parsers = FieldParserRegistry.withDefaults();

        private Builder() {
        }

        public Builder delimiter(char delimiter) {
            if (delimiter == '\n' || delimiter == '\r') {
                throw new IllegalArgumentException("delimiter must not be a line terminator");
            }
            this.delimiter = delimiter;
            return this;
        }

        public Builder charset(Charset charset) {
            if (charset == null) {
                throw new IllegalArgumentException("charset required");
            }
            this.charset = charset;
            return this;
        }

        public Builder fieldExtraction(FieldExtraction fieldExtraction) {
            if (fieldExtraction == null) {
                throw new IllegalArgumentException("fieldExtraction required");
            }
            this.fieldExtraction = fieldExtraction;
            return this;
        }

        public Builder malformedRecordPolicy(MalformedRecordPolicy malformedRecordPolicy) {
            if (malformedRecordPolicy == null) {
                throw new IllegalArgumentException("malformedRecordPolicy required");
            }
            this.malformedRecordPolicy = malformedRecordPolicy;
            return this;
        }

        /**
         * Register a parser for a column type, replacing any default for that type.
         */
        public <V> Builder parser(FieldParser<V> parser) {
            parsers.register(parser);
            return this;
        }

        public LoaderConfiguration build() {
            return new LoaderConfiguration(this);
        }
    }
}
