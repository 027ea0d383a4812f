package com.racelisting.sports.controller;

import com.racelisting.sports.dto.ListEventsRequest;
import com.racelisting.sports.dto.ListEventsResponse;
import com.racelisting.sports.model.Event;
import com.racelisting.sports.service.SportsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for sporting event listings.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class SportsController {

    private final SportsService sportsService;

    @PostMapping("/list-events")
    public ResponseEntity<ListEventsResponse> listEvents(@RequestBody(required = false) ListEventsRequest request) {
        return ResponseEntity.ok(sportsService.listEvents(request));
    }

    /** Single event, or 404. */
    @GetMapping("/events/{id}")
    public ResponseEntity<Event> getEvent(@PathVariable long id) {
        return ResponseEntity.ok(sportsService.getEvent(id));
    }
}
