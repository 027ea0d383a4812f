package com.racelisting.common.status;

import java.time.Instant;

/**
 * A listable entity with an advertised start and a derived status.
 */
public interface ScheduledListing {

    Instant getAdvertisedStartTime();

    void setStatus(String status);
}
