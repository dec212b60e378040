package io.memtab.loader;

import io.memtab.core.MemtabException;

/**
 * The text source could not be opened or read.
 */
public class TableSourceException extends MemtabException {

    public TableSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
