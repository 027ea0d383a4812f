package com.racelisting.common.query;

/**
 * Handling of an order request that has no field.
 */
public enum MissingFieldPolicy {

    /** Order by the configured default field, honouring the requested direction. */
    USE_DEFAULT,

    /** Ignore the whole order request. */
    IGNORE_ORDER
}
