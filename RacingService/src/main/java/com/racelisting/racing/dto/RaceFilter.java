package com.racelisting.racing.dto;

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
public class RaceFilter implements ListingFilter {

    private List<Long> meetingIds;

    private Boolean visible;

    private Long id;

    @Override
    public List<FilterCondition> conditions() {
        return List.of(
                FilterCondition.in("meeting_id", meetingIds),
                FilterCondition.flag("visible", visible),
                FilterCondition.equalTo("id", id));
    }
}
