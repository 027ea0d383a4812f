package com.racelisting.common.status;

/**
 * Read-time status of a listing. Entities without a start time carry an empty status.
 */
public enum ListingStatus {

    /** Advertised start is strictly in the future. */
    OPEN,

    /** Advertised start is now or in the past. */
    CLOSED
}
