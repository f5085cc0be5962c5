package com.dorkscan.scanner.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "duckduckgo")
@Validated
public record DuckDuckGoProperties(@NotBlank String baseUrl,
        @Min(1) @Max(500) int pageSize) {
}
