package com.racelisting.common.catalog;

import com.racelisting.common.config.ListingDatabase;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads column names through {@link DatabaseMetaData#getColumns}, for stores
 * without SQLite pragmas.
 */
@Slf4j
public class JdbcMetadataColumnCatalog implements ColumnCatalog {

    private final ListingDatabase database;

    public JdbcMetadataColumnCatalog(ListingDatabase database) {
        this.database = database;
    }

    @Override
    public Set<String> columnsOf(String table) throws ColumnCatalogUnavailableException {
        boolean opened = false;
        try {
            opened = database.openConnection();
            DatabaseMetaData metaData = Base.connection().getMetaData();

            Set<String> columns = new LinkedHashSet<>();
            // The table argument is a LIKE pattern, so '_' also matches other tables.
            try (ResultSet rs = metaData.getColumns(null, null, table, null)) {
                while (rs.next()) {
                    if (table.equals(rs.getString("TABLE_NAME"))) {
                        columns.add(rs.getString("COLUMN_NAME"));
                    }
                }
            }
            log.trace("Columns of {}: {}", table, columns);
            return columns;
        } catch (SQLException | RuntimeException e) {
            throw new ColumnCatalogUnavailableException("Failed to read column metadata for " + table, e);
        } finally {
            if (opened) {
                database.closeConnection();
            }
        }
    }
}
