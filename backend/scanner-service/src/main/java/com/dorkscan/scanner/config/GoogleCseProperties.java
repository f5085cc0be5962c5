package com.dorkscan.scanner.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "google.cse")
@Validated
public record GoogleCseProperties(@NotBlank String baseUrl,
        String apiKey,
        String cx) {

    /** Both the key and the search engine id are required; either one missing disables the API path. */
    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && cx != null && !cx.isBlank();
    }
}
