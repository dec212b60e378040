package io.memtab.loader;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Character-level field extraction over a text source with a pushback stack.
 * <p>
 * Lines end at {@code \n}; a {@code \r} directly before it is dropped from field text.
 * A lone {@code \r} after the last token of a record is discarded like a blank.
 * Extraction methods return {@code null} when the field is missing because the line or
 * the input ended first; the terminator is left unread in that case.
 */
final class RecordReader {
    private static final int EOF = -1;

    private final Reader in;
    private final Deque<Integer> pushedBack = new ArrayDeque<>();
    private int line = 1;

    RecordReader(Reader source) {
        this.in = source;
    }

    /**
     * 1-based number of the line the next character belongs to.
     */
    int line() {
        return line;
    }

    boolean atEnd() throws IOException {
        return peek() == EOF;
    }

    /**
     * True if the next line holds nothing but spaces, tabs and {@code \r}. Nothing is consumed.
     */
    boolean atBlankLine() throws IOException {
        var scanned = new ArrayDeque<Integer>();
        int c = read();
        while (c == ' ' || c == '\t' || c == '\r') {
            scanned.push(c);
            c = read();
        }
        boolean blank = c == '\n' || c == EOF;
        if (c != EOF) {
            unread(c);
        }
        while (!scanned.isEmpty()) {
            unread(scanned.pop());
        }
        return blank;
    }

    /**
     * Characters up to the delimiter, which is consumed.
     */
    String readUntil(char delimiter) throws IOException {
        var field = new StringBuilder();
        while (true) {
            int c = read();
            if (c == delimiter) {
                return field.toString();
            }
            if (c == EOF) {
                return null;
            }
            if (c == '\n') {
                unread(c);
                return null;
            }
            field.append((char) c);
        }
    }

    /**
     * Remainder of the current line, delimiters included; the line terminator is consumed.
     */
    String readRestOfLine() throws IOException {
        var field = new StringBuilder();
        int c = read();
        while (c != EOF && c != '\n') {
            field.append((char) c);
            c = read();
        }
        return stripCarriageReturn(field);
    }

    /**
     * Skip spaces and tabs, then read up to whitespace, the delimiter or the line end.
     * A delimiter following the token, possibly after spaces or tabs, is consumed.
     */
    String readToken(char delimiter) throws IOException {
        skipBlanks();
        var token = new StringBuilder();
        int c = read();
        while (c != EOF && c != delimiter && !Character.isWhitespace(c)) {
            token.append((char) c);
            c = read();
        }
        if (c != EOF && c != delimiter) {
            unread(c);
            skipBlanks();
            if (peek() == delimiter) {
                read();
            }
        }
        if (token.length() == 0) {
            return null;
        }
        return token.toString();
    }

    /**
     * Consume one line terminator if it is next; anything else stays unread and starts the next record.
     */
    void finishRecord(boolean skipTrailingBlanks) throws IOException {
        if (skipTrailingBlanks) {
            skipBlanks();
        }
        int c = read();
        if (c == '\r') {
            int next = read();
            if (next == '\n' || next == EOF) {
                return;
            }
            // Lone carriage return: dropped, the record ends here.
            unread(next);
            return;
        }
        if (c != '\n' && c != EOF) {
            unread(c);
        }
    }

    /**
     * Discard everything up to and including the next line terminator.
     */
    void skipLine() throws IOException {
        int c = read();
        while (c != EOF && c != '\n') {
            c = read();
        }
    }

    private void skipBlanks() throws IOException {
        int c = read();
        while (c == ' ' || c == '\t') {
            c = read();
        }
        if (c != EOF) {
            unread(c);
        }
    }

    private int peek() throws IOException {
        int c = read();
        if (c != EOF) {
            unread(c);
        }
        return c;
    }

    private int read() throws IOException {
        int c = pushedBack.isEmpty() ? in.read() : pushedBack.pop();
        if (c == '\n') {
            line++;
        }
        return c;
    }

    private void unread(int c) throws IOException {
        if (c == '\n') {
            line--;
        }
        pushedBack.push(c);
    }

    private static String stripCarriageReturn(StringBuilder field) {
        int length = field.length();
        if (length > 0 && field.charAt(length - 1) == '\r') {
            field.setLength(length - 1);
        }
        return field.toString();
    }
}
