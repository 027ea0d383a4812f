package com.racelisting.common.exception;

/**
 * The listing query failed in the store.
 */
public class ListingQueryException extends RuntimeException {

    public ListingQueryException(String message) {
        super(message);
    }

    public ListingQueryException(String message, Throwable cause) {
        super(message, cause);
    }

}
