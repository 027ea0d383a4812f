package com.racelisting.racing.dto;

import com.racelisting.common.query.OrderSpec;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListRacesRequest {

    private RaceFilter filter;

    private OrderSpec order;
}
