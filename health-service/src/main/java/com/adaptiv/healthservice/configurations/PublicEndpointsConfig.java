package com.adaptiv.healthservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

/**
 * Paths reachable without a bearer token, from {@code security.public-endpoints}.
 */
@Configuration
@ConfigurationProperties(prefix = "security")
@Getter
@Setter
public class PublicEndpointsConfig {

    private String[] publicEndpoints = new String[0];

    /**
     * Prefix match, so {@code /api/v1/health} also covers anything below it.
     */
    public boolean isPublic(String requestPath) {
        return requestPath != null && Arrays.stream(publicEndpoints).anyMatch(requestPath::startsWith);
    }
}
