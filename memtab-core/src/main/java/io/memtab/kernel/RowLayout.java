package io.memtab.kernel;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed, ordered row shape derived from a {@code record} class.
 * <p>
 * Each record component becomes one column, in declaration order. All reflection happens
 * once, here; reads and construction afterwards go through cached method handles.
 *
 * @param <R> the record type holding one row
 */
public final class RowLayout<R extends Record> {
    private static final Map<Class<?>, Class<?>> BOXED = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            float.class, Float.class,
            double.class, Double.class,
            char.class, Character.class);

    private final Class<R> rowType;
    private final List<Column<?>> columns;
    private final Map<String, Column<?>> columnsByName;
    private final MethodHandle[] accessors;
    private final MethodHandle constructor;

    private RowLayout(Class<R> rowType, List<Column<?>> columns, MethodHandle[] accessors, MethodHandle constructor) {
        this.rowType = rowType;
        this.columns = Collections.unmodifiableList(columns);
        this.columnsByName = new HashMap<>(columns.size());
        for (Column<?> column : columns) {
            columnsByName.put(column.name(), column);
        }
        this.accessors = accessors;
        this.constructor = constructor;
    }

    /**
     * Derive the layout of a record type.
     *
     * @throws IllegalArgumentException if the type is not a record or has no components
     */
    public static <R extends Record> RowLayout<R> of(Class<R> rowType) {
        if (rowType == null) {
            throw new IllegalArgumentException("rowType required");
        }
        if (!rowType.isRecord()) {
            throw new IllegalArgumentException("rowType must be a record: " + rowType.getName());
        }
        RecordComponent[] components = rowType.getRecordComponents();
        if (components.length == 0) {
            throw new IllegalArgumentException("rowType has no components: " + rowType.getName());
        }
        try {
            var lookup = MethodHandles.lookup();
            var columns = new ArrayList<Column<?>>(components.length);
            var accessors = new MethodHandle[components.length];
            var parameterTypes = new Class<?>[components.length];
            for (var i = 0; i < components.length; i++) {
                RecordComponent component = components[i];
                Class<?> declared = component.getType();
                parameterTypes[i] = declared;
                columns.add(column(component.getName(), declared, i));

                var accessor = component.getAccessor();
                accessor.setAccessible(true);
                accessors[i] = lookup.unreflect(accessor)
                        .asType(MethodType.methodType(Object.class, Object.class));
            }
            var canonical = rowType.getDeclaredConstructor(parameterTypes);
            canonical.setAccessible(true);
            var constructor = lookup.unreflectConstructor(canonical)
                    .asSpreader(Object[].class, components.length)
                    .asType(MethodType.methodType(Object.class, Object[].class));
            return new RowLayout<>(rowType, columns, accessors, constructor);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new IllegalArgumentException("Cannot derive row layout from " + rowType.getName(), e);
        }
    }

    private static Column<?> column(String name, Class<?> declared, int position) {
        if (declared.isPrimitive()) {
            return new Column<>(name, BOXED.get(declared), position, false);
        }
        return new Column<>(name, declared, position, true);
    }

    public Class<R> rowType() {
        return rowType;
    }

    public List<Column<?>> columns() {
        return columns;
    }

    public int arity() {
        return columns.size();
    }

    public Column<?> column(int position) {
        return columns.get(position);
    }

    /**
     * @return the column, or {@code null} if the layout has no column of that name
     */
    public Column<?> column(String name) {
        return columnsByName.get(name);
    }

    public Column<?> lastColumn() {
        return columns.get(columns.size() - 1);
    }

    public boolean isLast(Column<?> column) {
        return column.position() == columns.size() - 1;
    }

    /**
     * Positional read of one field.
     */
    public Object get(R row, int position) {
        if (row == null) {
            throw new IllegalArgumentException("row required");
        }
        try {
            return accessors[position].invokeExact((Object) row);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Cannot read column " + columns.get(position).name(), t);
        }
    }

    public <V> V get(R row, Column<V> column) {
        return column.type().cast(get(row, column.position()));
    }

    /**
     * Construct a row from one value per column, in layout order.
     *
     * @throws IllegalArgumentException if the count or any value type does not match the layout
     */
    public R newRow(Object... values) {
        checkValues(values);
        try {
            return rowType.cast(constructor.invokeExact(values));
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Cannot construct " + rowType.getSimpleName(), t);
        }
    }

    /**
     * Validate a positional value set against the layout without constructing a row.
     */
    public void checkValues(Object... values) {
        if (values == null || values.length != columns.size()) {
            throw new IllegalArgumentException("values length must match column count");
        }
        for (var i = 0; i < values.length; i++) {
            columns.get(i).cast(values[i]);
        }
    }

    @Override
    public String toString() {
        return rowType.getSimpleName() + Arrays.toString(columns.stream()
                .map(c -> c.name() + ":" + c.type().getSimpleName())
                .toArray());
    }
}
