package com.racelisting.racing.controller;

import com.racelisting.racing.dto.ListRacesRequest;
import com.racelisting.racing.dto.ListRacesResponse;
import com.racelisting.racing.model.Race;
import com.racelisting.racing.service.RacingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for race listings.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class RacingController {

    private final RacingService racingService;

    /**
     * Lists races.
     *
     * @param request optional filter and order; an empty body lists everything
     * @return matching races with their current status
     */
    @PostMapping("/list-races")
    public ResponseEntity<ListRacesResponse> listRaces(@RequestBody(required = false) ListRacesRequest request) {
        return ResponseEntity.ok(racingService.listRaces(request));
    }

    /**
     * Returns a single race.
     *
     * @param id race id
     * @return the race, or 404 when it does not exist
     */
    @GetMapping("/races/{id}")
    public ResponseEntity<Race> getRace(@PathVariable long id) {
        return ResponseEntity.ok(racingService.getRace(id));
    }
}
