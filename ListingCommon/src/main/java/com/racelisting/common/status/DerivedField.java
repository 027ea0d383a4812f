package com.racelisting.common.status;

/**
 * Computes one read-time field of an entity from its persisted fields.
 */
@FunctionalInterface
public interface DerivedField<T> {

    void apply(T entity);
}
