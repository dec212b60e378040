package io.memtab.core.converter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Registry of {@link FieldParser}s keyed by column type.
 * Provides default parsers for the common value types; callers may register their own.
 * Primitive types resolve to the parser of their wrapper, and any enum type without an
 * explicit registration is parsed by constant name.
 */
public final class FieldParserRegistry {
    private static final Map<Class<?>, Class<?>> PRIMITIVE_TO_BOXED = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            float.class, Float.class,
            double.class, Double.class,
            char.class, Character.class);

    private final Map<Class<?>, FieldParser<?>> parsers = new HashMap<>();

    private FieldParserRegistry() {
    }

    /**
     * Create a registry holding the default parsers.
     */
    public static FieldParserRegistry withDefaults() {
        var registry = new FieldParserRegistry();
        registry.registerDefaults();
        return registry;
    }

    private void registerDefaults() {
        register(FieldParser.of(String.class, text -> text));

        register(FieldParser.of(Integer.class, Integer::valueOf));
        register(FieldParser.of(Long.class, Long::valueOf));
        register(FieldParser.of(Short.class, Short::valueOf));
        register(FieldParser.of(Byte.class, Byte::valueOf));
        register(FieldParser.of(Double.class, Double::valueOf));
        register(FieldParser.of(Float.class, Float::valueOf));
        register(FieldParser.of(Boolean.class, FieldParserRegistry::parseBoolean));
        register(FieldParser.of(Character.class, FieldParserRegistry::parseCharacter));

        register(FieldParser.of(BigDecimal.class, BigDecimal::new));
        register(FieldParser.of(BigInteger.class, BigInteger::new));
        register(FieldParser.of(UUID.class, UUID::fromString));

        register(FieldParser.of(LocalDate.class, LocalDate::parse));
        register(FieldParser.of(LocalDateTime.class, LocalDateTime::parse));
        register(FieldParser.of(LocalTime.class, LocalTime::parse));
        register(FieldParser.of(Instant.class, Instant::parse));
    }

    public <V> void register(FieldParser<V> parser) {
        if (parser == null) {
            throw new IllegalArgumentException("parser required");
        }
        parsers.put(parser.javaType(), parser);
    }

    /**
     * Look up the parser for a column type.
     *
     * @return the parser, or {@code null} if the type is not supported
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public <V> FieldParser<V> getParser(Class<V> javaType) {
        Class<?> key = PRIMITIVE_TO_BOXED.getOrDefault(javaType, javaType);
        var parser = parsers.get(key);
        if (parser != null) {
            return (FieldParser<V>) parser;
        }
        if (key.isEnum()) {
            Class enumType = key;
            return (FieldParser<V>) FieldParser.of(enumType, text -> Enum.valueOf(enumType, (String) text));
        }
        return null;
    }

    public boolean supports(Class<?> javaType) {
        return getParser(javaType) != null;
    }

    /**
     * Independent copy; registrations on the copy do not affect this registry.
     */
    public FieldParserRegistry copy() {
        var copy = new FieldParserRegistry();
        copy.parsers.putAll(parsers);
        return copy;
    }

    private static Boolean parseBoolean(String text) {
        var normalized = text.toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return Boolean.TRUE;
        }
        if (normalized.equals("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean");
    }

    private static Character parseCharacter(String text) {
        if (text.length() != 1) {
            throw new IllegalArgumentException("expected exactly one character");
        }
        return text.charAt(0);
    }
}
