package io.memtab.storage;

import java.util.Iterator;

/**
 * Storage discipline behind a {@link SchemaTable}. Chosen once per table.
 */
interface RowStore<R> extends Iterable<R> {

    void add(R row);

    int size();

    /**
     * Read-only iterator; {@link Iterator#remove()} is unsupported.
     */
    @Override
    Iterator<R> iterator();
}
