package com.racelisting.sports.model;

import com.racelisting.common.status.DerivedField;
import com.racelisting.common.status.ScheduledListing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;

/**
 * A sporting event as listed to clients. {@code name} and {@code status} are
 * derived on every read and never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event implements ScheduledListing {

    /** Sets {@code name} to "&lt;away&gt; vs &lt;home&gt;"; a missing team reads as empty. */
    public static final DerivedField<Event> DISPLAY_NAME =
            event -> event.setName(String.format("%s vs %s",
                    StringUtils.defaultString(event.getAwayTeam()), StringUtils.defaultString(event.getHomeTeam())));

    private Long id;

    private String homeTeam;

    private String awayTeam;

    private String venueLocation;

    private boolean visible;

    private Instant advertisedStartTime;

    private String name;

    /** OPEN, CLOSED, or empty when there is no start time. */
    @Builder.Default
    private String status = "";
}
