package com.racelisting.common.catalog;

/**
 * The column catalog of a listing table could not be fetched or read.
 */
public class ColumnCatalogUnavailableException extends Exception {

    public ColumnCatalogUnavailableException(String message) {
        super(message);
    }

    public ColumnCatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
