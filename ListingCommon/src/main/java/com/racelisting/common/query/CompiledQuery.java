package com.racelisting.common.query;

import java.util.List;

/**
 * SQL text plus the positional arguments for its placeholders, in placeholder order.
 */
public record CompiledQuery(String sql, List<Object> arguments) {

    public CompiledQuery {
        arguments = List.copyOf(arguments);
    }

    public static CompiledQuery of(String sql) {
        return new CompiledQuery(sql, List.of());
    }

    public Object[] argumentArray() {
        return arguments.toArray();
    }
}
