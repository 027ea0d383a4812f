package com.racelisting.api.service;

import com.racelisting.api.exception.DownstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

/**
 * Forwards a JSON request to a listing service and relays its answer.
 */
@Component
@Slf4j
public class DownstreamClient {

    private final RestTemplate restTemplate;

    public DownstreamClient(RestTemplate downstreamRestTemplate) {
        this.restTemplate = downstreamRestTemplate;
    }

    /**
     * @param baseUrl service base URL
     * @param method  HTTP method
     * @param path    path below the base URL, e.g. "/v1/list-races"
     * @param body    JSON body, or null
     * @return the downstream status and body, error statuses included
     * @throws DownstreamUnavailableException when the service cannot be reached
     */
    public ResponseEntity<String> forward(String baseUrl, HttpMethod method, String path, String body) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl).path(path).toUriString();
        log.debug("Forwarding {} {}", method, url);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, method, new HttpEntity<>(body, headers), String.class);
            return relay(response.getStatusCode().value(), response.getBody());
        } catch (HttpStatusCodeException e) {
            log.debug("{} {} answered {}", method, url, e.getStatusCode());
            return relay(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw new DownstreamUnavailableException("Unable to reach " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private ResponseEntity<String> relay(int status, String body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
