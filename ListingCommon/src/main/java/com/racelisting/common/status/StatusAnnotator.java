package com.racelisting.common.status;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Post-query pass that fills in the read-time fields of listed entities.
 *
 * Derived fields run for every entity; the status is only set when the entity
 * has an advertised start, otherwise it keeps its empty default.
 */
public class StatusAnnotator<T extends ScheduledListing> {

    private final Clock clock;
    private final List<DerivedField<? super T>> derivedFields;

    public StatusAnnotator(Clock clock) {
        this(clock, List.of());
    }

    public StatusAnnotator(Clock clock, List<DerivedField<? super T>> derivedFields) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.derivedFields = List.copyOf(derivedFields);
    }

    /**
     * Annotates the given entities in place.
     *
     * @return the same list, or null when given null
     */
    public List<T> annotate(List<T> entities) {
        if (entities == null) {
            return null;
        }

        Instant now = clock.instant();
        for (T entity : entities) {
            for (DerivedField<? super T> field : derivedFields) {
                field.apply(entity);
            }

            Instant start = entity.getAdvertisedStartTime();
            if (start != null) {
                entity.setStatus(statusAt(start, now).name());
            }
        }
        return entities;
    }

    /**
     * A start exactly equal to {@code now} is not in the future, so it is CLOSED.
     */
    public static ListingStatus statusAt(Instant start, Instant now) {
        return start.isAfter(now) ? ListingStatus.OPEN : ListingStatus.CLOSED;
    }
}
