package io.memtab.core;

/**
 * Fixed-capacity table identifier.
 * <p>
 * Purely descriptive: it is never stored per row and takes no part in storage decisions.
 */
public record TableName(String value) {
    public static final int MAX_LENGTH = 64;

    public TableName {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("name longer than " + MAX_LENGTH + " characters: " + value.length());
        }
        for (var i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                throw new IllegalArgumentException("name contains control character at index " + i);
            }
        }
    }

    public static TableName of(String value) {
        return new TableName(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
