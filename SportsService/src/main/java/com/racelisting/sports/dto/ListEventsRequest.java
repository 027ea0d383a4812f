package com.racelisting.sports.dto;

import com.racelisting.common.query.OrderSpec;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListEventsRequest {

    private EventFilter filter;

    private OrderSpec order;
}
