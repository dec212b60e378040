package io.memtab.storage;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Insertion-ordered store backed by a growable array.
 * <p>
 * Iterators capture the row count at creation, so appends made while iterating are not
 * observed and never invalidate the cursor.
 */
final class AppendRowStore<R> implements RowStore<R> {
    private static final int DEFAULT_CAPACITY = 16;

    private Object[] data;
    private int size;

    AppendRowStore() {
        this(DEFAULT_CAPACITY);
    }

    AppendRowStore(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        this.data = new Object[initialCapacity];
    }

    @Override
    public void add(R row) {
        ensureCapacity(size + 1);
        data[size++] = row;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Iterator<R> iterator() {
        return new Cursor<>(data, size);
    }

    private void ensureCapacity(int desired) {
        if (desired <= data.length) {
            return;
        }
        int newCapacity = Math.max(data.length * 2, desired);
        data = Arrays.copyOf(data, newCapacity);
    }

    private static final class Cursor<R> implements Iterator<R> {
        // Growth copies into a new array; the captured one keeps its prefix intact.
        private final Object[] snapshot;
        private final int limit;
        private int next;

        private Cursor(Object[] snapshot, int limit) {
            this.snapshot = snapshot;
            this.limit = limit;
        }

        @Override
        public boolean hasNext() {
            return next < limit;
        }

        @Override
        @SuppressWarnings("unchecked")
        public R next() {
            if (next >= limit) {
                throw new NoSuchElementException();
            }
            return (R) snapshot[next++];
        }
    }
}
