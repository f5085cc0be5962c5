package com.dorkscan.scanner.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Optional SOCKS5 route (typically a local Tor daemon). The proxy process itself is managed
 * outside this application.
 */
@ConfigurationProperties(prefix = "scan.proxy")
@Validated
public record ProxyProperties(boolean enabled,
        @NotBlank String host,
        @Min(1) @Max(65535) int port) {
}
