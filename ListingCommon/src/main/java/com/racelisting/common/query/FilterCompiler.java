package com.racelisting.common.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link ListingFilter} into a WHERE clause appended to a base select.
 */
public final class FilterCompiler {

    private FilterCompiler() {
    }

    /**
     * @param baseQuery select statement without any trailing clause
     * @param filter    optional filter
     * @return the base query unchanged with no arguments when nothing is
     *         constrained, otherwise the query with {@code " WHERE a AND b ..."}
     *         and the arguments in placeholder order
     */
    public static CompiledQuery compile(String baseQuery, ListingFilter filter) {
        if (filter == null) {
            return CompiledQuery.of(baseQuery);
        }

        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        for (FilterCondition condition : filter.conditions()) {
            if (condition == null || !condition.isPresent()) {
                continue;
            }
            conditions.add(condition.toSql());
            params.addAll(condition.arguments());
        }

        if (conditions.isEmpty()) {
            return CompiledQuery.of(baseQuery);
        }
        return new CompiledQuery(baseQuery + " WHERE " + String.join(" AND ", conditions), params);
    }
}
