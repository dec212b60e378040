package io.memtab.loader;

import io.memtab.core.MemtabException;

/**
 * A record did not match the row layout: a field was missing, could not be parsed,
 * or the input ended part-way through the record.
 */
public class MalformedRecordException extends MemtabException {
    private final int line;
    private final String column;

    public MalformedRecordException(int line, String column, String message) {
        this(line, column, message, null);
    }

    public MalformedRecordException(int line, String column, String message, Throwable cause) {
        super(describe(line, column, message), cause);
        this.line = line;
        this.column = column;
    }

    /**
     * 1-based line on which the record starts.
     */
    public int line() {
        return line;
    }

    /**
     * Name of the offending column, or {@code null} when the whole record was rejected.
     */
    public String column() {
        return column;
    }

    private static String describe(int line, String column, String message) {
        if (column == null) {
            return "line " + line + ": " + message;
        }
        return "line " + line + ", column '" + column + "': " + message;
    }
}
