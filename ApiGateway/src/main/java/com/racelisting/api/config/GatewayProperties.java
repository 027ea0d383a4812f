package com.racelisting.api.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed binding for gateway.* configuration.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** Base URL of the racing service. */
    @NotBlank(message = "Racing endpoint is required")
    private String racingEndpoint = "http://localhost:9000";

    /** Base URL of the sports service. */
    @NotBlank(message = "Sports endpoint is required")
    private String sportsEndpoint = "http://localhost:10000";

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 10000;
}
