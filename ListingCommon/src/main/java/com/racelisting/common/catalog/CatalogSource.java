package com.racelisting.common.catalog;

/** Metadata source backing a {@link ColumnCatalog}. */
public enum CatalogSource {

    /** SQLite {@code pragma_table_info}. */
    PRAGMA,

    /** JDBC {@link java.sql.DatabaseMetaData}, store independent. */
    JDBC_METADATA
}
