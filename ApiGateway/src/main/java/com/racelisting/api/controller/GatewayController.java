package com.racelisting.api.controller;

import com.racelisting.api.config.GatewayProperties;
import com.racelisting.api.service.DownstreamClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Public routes, each mapped onto the listing service that owns it.
 */
@RestController
@RequestMapping(value = "/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class GatewayController {

    private final DownstreamClient downstreamClient;
    private final GatewayProperties gatewayProperties;

    @PostMapping("/list-races")
    public ResponseEntity<String> listRaces(@RequestBody(required = false) String body) {
        return downstreamClient.forward(gatewayProperties.getRacingEndpoint(), HttpMethod.POST, "/v1/list-races", body);
    }

    @GetMapping("/races/{id}")
    public ResponseEntity<String> getRace(@PathVariable long id) {
        return downstreamClient.forward(gatewayProperties.getRacingEndpoint(), HttpMethod.GET, "/v1/races/" + id, null);
    }

    @PostMapping("/list-events")
    public ResponseEntity<String> listEvents(@RequestBody(required = false) String body) {
        return downstreamClient.forward(gatewayProperties.getSportsEndpoint(), HttpMethod.POST, "/v1/list-events", body);
    }

    @GetMapping("/events/{id}")
    public ResponseEntity<String> getEvent(@PathVariable long id) {
        return downstreamClient.forward(gatewayProperties.getSportsEndpoint(), HttpMethod.GET, "/v1/events/" + id, null);
    }
}
