package com.racelisting.common.catalog;

import java.util.Set;

/**
 * Live view of the columns a listing table currently has.
 *
 * Implementations must query the store on every call; the result is used to
 * decide whether a client-supplied sort field may be written into SQL.
 */
@FunctionalInterface
public interface ColumnCatalog {

    /**
     * @param table table name
     * @return exact (case-sensitive) column names; empty when the table does not exist
     * @throws ColumnCatalogUnavailableException when the metadata cannot be fetched or read
     */
    Set<String> columnsOf(String table) throws ColumnCatalogUnavailableException;
}
