package io.memtab.kernel;

/**
 * Column descriptor: name, value type and position within the row layout.
 * Primitive value types are reported boxed; {@link #nullable()} tells them apart.
 */
public record Column<V>(String name, Class<V> type, int position, boolean nullable) {

    public Column {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("type must be boxed: " + type);
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative");
        }
    }

    /**
     * Textual columns honor the loader's delimiter and may take the rest of a line.
     */
    public boolean isTextual() {
        return type == String.class;
    }

    /**
     * Check that a value can be stored in this column.
     *
     * @throws IllegalArgumentException on a type mismatch or a null for a non-nullable column
     */
    public V cast(Object value) {
        if (value == null) {
            if (!nullable) {
                throw new IllegalArgumentException("column '" + name + "' does not accept null");
            }
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("column '" + name + "' expects " + type.getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }
}
