package io.memtab.storage;

import io.memtab.core.TableName;
import io.memtab.index.ColumnIndex;
import io.memtab.kernel.Ordering;
import io.memtab.kernel.RowLayout;

import java.util.Comparator;

/**
 * Everything needed to build an empty table: name, ordering policy and row layout.
 */
public record TableSpec<R extends Record>(TableName name, Ordering<R> ordering, RowLayout<R> layout) {

    public TableSpec {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        if (ordering == null) {
            throw new IllegalArgumentException("ordering required");
        }
        if (layout == null) {
            throw new IllegalArgumentException("layout required");
        }
    }

    public static <R extends Record> TableSpec<R> unordered(String name, Class<R> rowType) {
        return new TableSpec<>(TableName.of(name), Ordering.unordered(), RowLayout.of(rowType));
    }

    public static <R extends Record> TableSpec<R> keyed(String name, Class<R> rowType,
                                                        Comparator<? super R> comparator) {
        return new TableSpec<>(TableName.of(name), Ordering.keyed(comparator), RowLayout.of(rowType));
    }

    /**
     * Keyed table sorted by the named columns, in order.
     */
    public static <R extends Record> TableSpec<R> keyedBy(String name, Class<R> rowType, String... keyColumns) {
        var layout = RowLayout.of(rowType);
        return new TableSpec<>(TableName.of(name), Ordering.keyed(ColumnIndex.on(layout, keyColumns)), layout);
    }

    public SchemaTable<R> newTable() {
        return SchemaTable.create(name, ordering, layout);
    }
}
