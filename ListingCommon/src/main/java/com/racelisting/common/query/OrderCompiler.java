package com.racelisting.common.query;

import com.racelisting.common.catalog.ColumnCatalog;
import com.racelisting.common.catalog.ColumnCatalogUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Set;

/**
 * Appends an ORDER BY clause for a client supplied {@link OrderSpec}.
 *
 * The sort field is written into the SQL text, so it is only accepted when it
 * matches (case-sensitively) a column the store reports for the table at the
 * time of the call. Every failure degrades to returning the query unchanged;
 * this class never throws.
 */
@Slf4j
public class OrderCompiler {

    private final ColumnCatalog catalog;
    private final String table;
    private final String defaultField;
    private final MissingFieldPolicy missingFieldPolicy;

    public OrderCompiler(ColumnCatalog catalog, String table, String defaultField,
                         MissingFieldPolicy missingFieldPolicy) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.table = Objects.requireNonNull(table, "table");
        this.defaultField = defaultField;
        this.missingFieldPolicy = missingFieldPolicy != null ? missingFieldPolicy : MissingFieldPolicy.USE_DEFAULT;
    }

    public String compile(String baseQuery, OrderSpec order) {
        return resolve(baseQuery, order).sql();
    }

    public OrderResult resolve(String baseQuery, OrderSpec order) {
        if (order == null) {
            return OrderResult.unchanged(baseQuery, OrderOutcome.NOT_REQUESTED);
        }

        String field = order.getField();
        if (field == null || field.isEmpty()) {
            if (missingFieldPolicy == MissingFieldPolicy.IGNORE_ORDER || defaultField == null) {
                log.debug("Order on {} has no field, ignoring it", table);
                return OrderResult.unchanged(baseQuery, OrderOutcome.SKIPPED_NO_FIELD);
            }
            field = defaultField;
        }

        Set<String> columns;
        try {
            columns = catalog.columnsOf(table);
        } catch (ColumnCatalogUnavailableException | RuntimeException e) {
            log.warn("Failed to get column names for {}, continuing without ordering: {}", table, e.getMessage());
            return OrderResult.unchanged(baseQuery, OrderOutcome.SKIPPED_CATALOG_UNAVAILABLE);
        }

        if (columns == null || !columns.contains(field)) {
            log.debug("Order field '{}' is not a column of {}, ignoring it", field, table);
            return OrderResult.unchanged(baseQuery, OrderOutcome.SKIPPED_INVALID_FIELD);
        }

        StringBuilder sql = new StringBuilder(baseQuery).append(" ORDER BY ").append(field);
        SortDirection.parse(order.getDirection())
                .ifPresent(direction -> sql.append(' ').append(direction.name()));

        return new OrderResult(sql.toString(), OrderOutcome.APPLIED);
    }

    public String getTable() {
        return table;
    }

    public String getDefaultField() {
        return defaultField;
    }

    public MissingFieldPolicy getMissingFieldPolicy() {
        return missingFieldPolicy;
    }
}
