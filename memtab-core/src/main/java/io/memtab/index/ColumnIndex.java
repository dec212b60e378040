package io.memtab.index;

import io.memtab.kernel.Column;
import io.memtab.kernel.RowLayout;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Lexicographic row comparator over a list of key columns.
 * <p>
 * Key values must be {@link Comparable}; {@code null} sorts before any value.
 * Rows are compared column by column until one differs.
 */
public final class ColumnIndex<R extends Record> implements Comparator<R> {
    private final RowLayout<R> layout;
    private final int[] positions;
    private final List<String> columnNames;

    private ColumnIndex(RowLayout<R> layout, int[] positions, List<String> columnNames) {
        this.layout = layout;
        this.positions = positions;
        this.columnNames = columnNames;
    }

    /**
     * Build an index over the named columns of a layout.
     *
     * @throws IllegalArgumentException if no column is named, a name is unknown, or a column is not comparable
     */
    public static <R extends Record> ColumnIndex<R> on(RowLayout<R> layout, String... columnNames) {
        if (layout == null) {
            throw new IllegalArgumentException("layout required");
        }
        if (columnNames == null || columnNames.length == 0) {
            throw new IllegalArgumentException("at least one key column required");
        }
        var positions = new int[columnNames.length];
        for (var i = 0; i < columnNames.length; i++) {
            Column<?> column = layout.column(columnNames[i]);
            if (column == null) {
                throw new IllegalArgumentException("unknown column: " + columnNames[i]);
            }
            if (!Comparable.class.isAssignableFrom(column.type())) {
                throw new IllegalArgumentException("column '" + column.name() + "' is not comparable: "
                        + column.type().getSimpleName());
            }
            positions[i] = column.position();
        }
        return new ColumnIndex<>(layout, positions, List.of(columnNames));
    }

    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public int compare(R left, R right) {
        for (int position : positions) {
            var cmp = comparePart(layout.get(left, position), layout.get(right, position));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static int comparePart(Object left, Object right) {
        if (left == right) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        return ((Comparable) left).compareTo(right);
    }

    @Override
    public String toString() {
        return "ColumnIndex" + Arrays.toString(columnNames.toArray());
    }
}
