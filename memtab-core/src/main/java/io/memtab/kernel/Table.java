package io.memtab.kernel;

import io.memtab.core.TableName;

import java.util.List;
import java.util.stream.Stream;

/**
 * Named, grow-only collection of rows sharing one {@link RowLayout}.
 * <p>
 * Iteration order is decided by the table's {@link Ordering}: insertion order when
 * unordered, non-decreasing comparator order when keyed. Iterators are read-only.
 * Not safe for concurrent use.
 *
 * @param <R> the row type
 */
public interface Table<R extends Record> extends Iterable<R> {
    TableName name();

    RowLayout<R> layout();

    Ordering<R> ordering();

    long rowCount();

    default boolean isEmpty() {
        return rowCount() == 0;
    }

    void insert(R row);

    /**
     * Build a row from one value per column, in layout order, and insert it.
     */
    void emplace(Object... values);

    /**
     * Insert one row per index position, zipping the i-th element of every column list.
     * All lists must have the same length; nothing is inserted otherwise.
     */
    void insertColumns(List<?>... columns);

    Stream<R> stream();

    /**
     * Immutable snapshot of the current rows, in iteration order.
     */
    List<R> rows();
}
