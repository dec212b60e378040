package io.memtab.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/**
 * Sorted multi-collection: rows that compare equal share one bucket and are all kept.
 * <p>
 * Iteration is in non-decreasing comparator order; within a bucket rows appear in
 * insertion order. Iterators fail fast once the store is modified.
 */
final class SortedRowStore<R> implements RowStore<R> {
    private final TreeMap<R, List<R>> buckets;
    private int size;
    private int modCount;

    SortedRowStore(Comparator<? super R> comparator) {
        if (comparator == null) {
            throw new IllegalArgumentException("comparator required");
        }
        this.buckets = new TreeMap<>(comparator);
    }

    @Override
    public void add(R row) {
        buckets.computeIfAbsent(row, ignored -> new ArrayList<>(1)).add(row);
        size++;
        modCount++;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Iterator<R> iterator() {
        return new Cursor();
    }

    private final class Cursor implements Iterator<R> {
        private final Iterator<List<R>> bucketIterator = buckets.values().iterator();
        private final int expectedModCount = modCount;
        private List<R> bucket = List.of();
        private int index;

        @Override
        public boolean hasNext() {
            checkForModification();
            while (index >= bucket.size()) {
                if (!bucketIterator.hasNext()) {
                    return false;
                }
                bucket = bucketIterator.next();
                index = 0;
            }
            return true;
        }

        @Override
        public R next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return bucket.get(index++);
        }

        private void checkForModification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException("table modified during iteration");
            }
        }
    }
}
