package com.mimecast.warden.query;

import java.util.Objects;

/**
 * Leaf expression matching a substring in one envelope field.
 *
 * <p>Compiles to {@code (FIELD "value")}.
 */
public final class FieldMatch implements Expression {

    private final Field field;
    private final String value;

    /**
     * Constructs a new FieldMatch instance.
     *
     * @param field Field to match.
     * @param value Substring to look for.
     * @throws IllegalArgumentException If value contains line breaks.
     */
    public FieldMatch(Field field, String value) {
        this.field = Objects.requireNonNull(field, "field");
        this.value = Objects.requireNonNull(value, "value");
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Match value must be a single line: " + value);
        }
    }

    public Field getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String compile() {
        return "(" + field.keyword() + " \"" + quote(value) + "\")";
    }

    /**
     * Escapes backslash and double quote for an IMAP quoted string.
     */
    private static String quote(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldMatch)) return false;
        FieldMatch that = (FieldMatch) o;
        return field == that.field && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value);
    }

    @Override
    public String toString() {
        return compile();
    }
}
