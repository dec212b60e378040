package io.memtab.storage;

import io.memtab.core.TableName;
import io.memtab.kernel.Ordering;
import io.memtab.kernel.RowLayout;
import io.memtab.kernel.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link Table} whose storage discipline is picked from its {@link Ordering} at construction:
 * an append-only array for {@link Ordering.Unordered}, a sorted multi-collection for
 * {@link Ordering.Keyed}. Every insertion path funnels into the same store; no operation
 * inspects the policy again.
 */
public final class SchemaTable<R extends Record> implements Table<R> {
    private static final int SPLITERATOR_CHARACTERISTICS = Spliterator.ORDERED | Spliterator.NONNULL;

    private final TableName name;
    private final Ordering<R> ordering;
    private final RowLayout<R> layout;
    private final RowStore<R> store;

    private SchemaTable(TableName name, Ordering<R> ordering, RowLayout<R> layout) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        if (ordering == null) {
            throw new IllegalArgumentException("ordering required");
        }
        if (layout == null) {
            throw new IllegalArgumentException("layout required");
        }
        this.name = name;
        this.ordering = ordering;
        this.layout = layout;
        this.store = ordering.<RowStore<R>>select(AppendRowStore::new, SortedRowStore::new);
    }

    public static <R extends Record> SchemaTable<R> create(TableName name, Ordering<R> ordering, RowLayout<R> layout) {
        return new SchemaTable<>(name, ordering, layout);
    }

    /**
     * Create a table pre-seeded column-wise; see {@link #insertColumns(List[])}.
     */
    public static <R extends Record> SchemaTable<R> create(TableName name, Ordering<R> ordering, RowLayout<R> layout,
                                                           List<?>... columns) {
        var table = new SchemaTable<>(name, ordering, layout);
        table.insertColumns(columns);
        return table;
    }

    @Override
    public TableName name() {
        return name;
    }

    @Override
    public RowLayout<R> layout() {
        return layout;
    }

    @Override
    public Ordering<R> ordering() {
        return ordering;
    }

    @Override
    public long rowCount() {
        return store.size();
    }

    @Override
    public void insert(R row) {
        if (row == null) {
            throw new IllegalArgumentException("row required");
        }
        store.add(row);
    }

    @Override
    public void emplace(Object... values) {
        store.add(layout.newRow(values));
    }

    @Override
    public void insertColumns(List<?>... columns) {
        if (columns == null || columns.length != layout.arity()) {
            throw new IllegalArgumentException("column count must match layout arity " + layout.arity());
        }
        int length = -1;
        for (var i = 0; i < columns.length; i++) {
            if (columns[i] == null) {
                throw new IllegalArgumentException("column " + layout.column(i).name() + " required");
            }
            if (length < 0) {
                length = columns[i].size();
            } else if (columns[i].size() != length) {
                throw new IllegalArgumentException("column lengths differ: " + layout.column(0).name() + "="
                        + length + ", " + layout.column(i).name() + "=" + columns[i].size());
            }
        }

        // Build every row first so a bad value leaves the table untouched.
        var rows = new ArrayList<R>(length);
        var values = new Object[columns.length];
        for (var row = 0; row < length; row++) {
            for (var col = 0; col < columns.length; col++) {
                values[col] = columns[col].get(row);
            }
            rows.add(layout.newRow(values.clone()));
        }
        for (R row : rows) {
            store.add(row);
        }
    }

    @Override
    public Iterator<R> iterator() {
        return store.iterator();
    }

    /**
     * Sized over the rows present when this method is called.
     */
    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliterator(iterator(), store.size(), SPLITERATOR_CHARACTERISTICS);
    }

    /**
     * Binds to the rows when the terminal operation starts, not when the stream is created.
     */
    @Override
    public Stream<R> stream() {
        return StreamSupport.stream(this::spliterator,
                SPLITERATOR_CHARACTERISTICS | Spliterator.SIZED | Spliterator.SUBSIZED, false);
    }

    @Override
    public List<R> rows() {
        var rows = new ArrayList<R>(store.size());
        for (R row : store) {
            rows.add(row);
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public String toString() {
        return "SchemaTable{name=" + name + ", rows=" + store.size()
                + ", ordering=" + (ordering.isKeyed() ? "keyed" : "unordered") + "}";
    }
}
