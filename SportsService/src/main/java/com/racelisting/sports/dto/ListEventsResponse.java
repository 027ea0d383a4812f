package com.racelisting.sports.dto;

import com.racelisting.sports.model.Event;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListEventsResponse {

    private List<Event> events;
}
