package com.racelisting.common.query;

import java.util.List;

/**
 * A structured, per-field optional filter over the persisted columns of a listing table.
 */
public interface ListingFilter {

    /**
     * All conditions this filter can express, in the fixed order they are
     * written to SQL. Absent fields are returned as absent conditions rather
     * than left out, so the order never depends on which fields are set.
     */
    List<FilterCondition> conditions();
}
