package io.memtab.core.converter;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts one extracted text field into a column value.
 * Similar in spirit to a type converter, but one-directional: text in, value out.
 *
 * @param <V> the Java type of the column
 */
public interface FieldParser<V> {

    /**
     * Get the Java type this parser produces.
     */
    Class<V> javaType();

    /**
     * Parse the raw field text.
     *
     * @throws IllegalArgumentException if the text is not a valid value of {@link #javaType()}
     */
    V parse(String text);

    /**
     * Adapts a plain parsing function, reporting any runtime failure as
     * {@link IllegalArgumentException} with a uniform message.
     */
    static <V> FieldParser<V> of(Class<V> javaType, Function<String, ? extends V> function) {
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(function, "function");
        return new FieldParser<>() {
            @Override
            public Class<V> javaType() {
                return javaType;
            }

            @Override
            public V parse(String text) {
                try {
                    return function.apply(text);
                } catch (RuntimeException e) {
                    throw new IllegalArgumentException(
                            "Cannot parse '" + text + "' as " + javaType.getSimpleName(), e);
                }
            }

            @Override
            public String toString() {
                return "FieldParser[" + javaType.getSimpleName() + "]";
            }
        };
    }
}
