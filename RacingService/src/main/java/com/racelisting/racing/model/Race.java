package com.racelisting.racing.model;

import com.racelisting.common.status.ScheduledListing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A race as listed to clients. {@code status} is computed on every read and never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Race implements ScheduledListing {

    private Long id;

    /** Meeting the race belongs to. */
    private Long meetingId;

    private String name;

    /** Race number within the meeting. */
    private Integer number;

    private boolean visible;

    private Instant advertisedStartTime;

    /** OPEN, CLOSED, or empty when there is no start time. */
    @Builder.Default
    private String status = "";
}
