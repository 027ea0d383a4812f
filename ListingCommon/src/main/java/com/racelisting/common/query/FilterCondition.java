package com.racelisting.common.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * One optional predicate of a listing filter.
 *
 * Column names always come from code, never from the request; only values are
 * client supplied. A condition whose value is absent contributes nothing.
 */
public final class FilterCondition {

    enum Kind {
        /** {@code column IN (?,...)}, one argument per value. */
        MEMBERSHIP,
        /** {@code column = ?}, one argument. */
        EQUALITY,
        /** {@code column = true|false}, inlined, no argument. */
        FLAG
    }

    private final Kind kind;
    private final String column;
    private final List<Object> values;

    private FilterCondition(Kind kind, String column, List<Object> values) {
        this.kind = kind;
        this.column = column;
        this.values = values;
    }

    /**
     * Membership constraint. A null or empty collection means "no constraint".
     */
    public static FilterCondition in(String column, Collection<?> values) {
        List<Object> copy = values == null ? Collections.emptyList() : new ArrayList<>(values);
        return new FilterCondition(Kind.MEMBERSHIP, column, Collections.unmodifiableList(copy));
    }

    /**
     * Equality constraint bound as a parameter. A null value means "no constraint".
     */
    public static FilterCondition equalTo(String column, Object value) {
        return new FilterCondition(Kind.EQUALITY, column, singleValue(value));
    }

    /**
     * Boolean equality constraint, written into the SQL as a literal.
     * A null value means "no constraint".
     */
    public static FilterCondition flag(String column, Boolean value) {
        return new FilterCondition(Kind.FLAG, column, singleValue(value));
    }

    private static List<Object> singleValue(Object value) {
        return value == null ? Collections.emptyList() : Collections.singletonList(value);
    }

    public String getColumn() {
        return column;
    }

    Kind getKind() {
        return kind;
    }

    public boolean isPresent() {
        return !values.isEmpty();
    }

    /**
     * SQL fragment for this condition; only meaningful when {@link #isPresent()}.
     */
    String toSql() {
        switch (kind) {
            case MEMBERSHIP:
                return column + " IN (" + "?,".repeat(values.size() - 1) + "?)";
            case FLAG:
                return column + " = " + values.get(0);
            default:
                return column + " = ?";
        }
    }

    /**
     * Values bound to the placeholders of {@link #toSql()}, left to right.
     */
    List<Object> arguments() {
        return kind == Kind.FLAG ? Collections.emptyList() : values;
    }

    @Override
    public String toString() {
        return isPresent() ? toSql() + " " + arguments() : column + " <absent>";
    }
}
