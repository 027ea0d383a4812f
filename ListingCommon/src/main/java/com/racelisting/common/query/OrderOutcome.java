package com.racelisting.common.query;

/**
 * What the order compiler did with a request. Only {@link #APPLIED} changes the query.
 */
public enum OrderOutcome {
    NOT_REQUESTED,
    APPLIED,
    SKIPPED_NO_FIELD,
    SKIPPED_INVALID_FIELD,
    SKIPPED_CATALOG_UNAVAILABLE;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
