package com.racelisting.sports.dto;

import com.racelisting.common.query.FilterCondition;
import com.racelisting.common.query.ListingFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventFilter implements ListingFilter {

    private String homeTeam;

    private String awayTeam;

    private String venueLocation;

    private Boolean visible;

    @Override
    public List<FilterCondition> conditions() {
        return List.of(
                FilterCondition.equalTo("home_team", homeTeam),
                FilterCondition.equalTo("away_team", awayTeam),
                FilterCondition.equalTo("venue_location", venueLocation),
                FilterCondition.flag("visible", visible));
    }
}
