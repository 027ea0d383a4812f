package com.racelisting.common.catalog;

import com.racelisting.common.config.ListingDatabase;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads column names from SQLite's {@code pragma_table_info} table-valued function.
 */
@Slf4j
public class SqliteColumnCatalog implements ColumnCatalog {

    static final String COLUMNS_QUERY = "SELECT name FROM pragma_table_info(?)";

    private final ListingDatabase database;

    public SqliteColumnCatalog(ListingDatabase database) {
        this.database = database;
    }

    @Override
    public Set<String> columnsOf(String table) throws ColumnCatalogUnavailableException {
        List<?> names;
        try {
            names = database.withConnection(() -> Base.firstColumn(COLUMNS_QUERY, table));
        } catch (RuntimeException e) {
            throw new ColumnCatalogUnavailableException("Failed to get column names for " + table, e);
        }

        Set<String> columns = new LinkedHashSet<>();
        for (Object name : names) {
            if (!(name instanceof String column)) {
                throw new ColumnCatalogUnavailableException(
                        "Failed to parse column names for " + table + ": unexpected value " + name);
            }
            columns.add(column);
        }
        log.trace("Columns of {}: {}", table, columns);
        return columns;
    }
}
