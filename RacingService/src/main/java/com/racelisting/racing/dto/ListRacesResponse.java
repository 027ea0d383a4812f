package com.racelisting.racing.dto;

import com.racelisting.racing.model.Race;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListRacesResponse {

    private List<Race> races;
}
