package com.racelisting.common.exception;

/**
 * No listing matched the requested identifier.
 */
public class ListingNotFoundException extends RuntimeException {

    private final String entity;
    private final long id;

    public ListingNotFoundException(String entity, long id) {
        super("Unable to locate a " + entity + " with the provided ID: " + id);
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public long getId() {
        return id;
    }

}
