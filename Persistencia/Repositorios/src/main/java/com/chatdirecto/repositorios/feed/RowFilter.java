package com.chatdirecto.repositorios.feed;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Predicado sobre columnas de una fila JSON. Su forma textual
 * (p. ej. {@code or(and(sender_id=eq.a,receiver_id=eq.b),...)}) es canónica y sirve de clave.
 */
public abstract class RowFilter {

    private static final RowFilter ALL = new RowFilter() {
        @Override
        public boolean matches(JsonNode row) {
            return row != null;
        }

        @Override
        public String toString() {
            return "*";
        }
    };

    public abstract boolean matches(JsonNode row);

    public static RowFilter all() {
        return ALL;
    }

    public static RowFilter eq(String column, String value) {
        return new Equals(column, value);
    }

    public static RowFilter and(RowFilter... parts) {
        return new Composite("and", true, Arrays.asList(parts));
    }

    public static RowFilter or(RowFilter... parts) {
        return new Composite("or", false, Arrays.asList(parts));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RowFilter && toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    private static final class Equals extends RowFilter {
        private final String column;
        private final String value;

        private Equals(String column, String value) {
            this.column = Objects.requireNonNull(column, "column");
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean matches(JsonNode row) {
            if (row == null) {
                return false;
            }
            JsonNode field = row.get(column);
            return field != null && !field.isNull() && value.equals(field.asText());
        }

        @Override
        public String toString() {
            return column + "=eq." + value;
        }
    }

    private static final class Composite extends RowFilter {
        private final String operator;
        private final boolean conjunction;
        private final List<RowFilter> parts;

        private Composite(String operator, boolean conjunction, List<RowFilter> parts) {
            if (parts.isEmpty()) {
                throw new IllegalArgumentException("Un filtro compuesto necesita al menos una parte");
            }
            this.operator = operator;
            this.conjunction = conjunction;
            this.parts = List.copyOf(parts);
        }

        @Override
        public boolean matches(JsonNode row) {
            if (conjunction) {
                return parts.stream().allMatch(part -> part.matches(row));
            }
            return parts.stream().anyMatch(part -> part.matches(row));
        }

        @Override
        public String toString() {
            return parts.stream()
                .map(RowFilter::toString)
                .collect(Collectors.joining(",", operator + "(", ")"));
        }
    }
}
