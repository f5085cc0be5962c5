package com.dorkscan.scanner.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Run-wide scan settings, bound from {@code scan.*}. Every field can be overridden on the
 * command line, e.g. {@code --scan.target=example.com --scan.snapshot=true}.
 */
@ConfigurationProperties(prefix = "scan")
@Validated
public record ScanProperties(String category,
        String target,
        @Min(1) int num,
        @Min(1) @Max(64) int concurrency,
        @NotNull Duration delay,
        @NotNull Duration cooldown,
        boolean allowSensitive,
        boolean snapshot,
        @NotBlank String outputDir,
        @NotBlank String dorksFile,
        boolean ignoreSsl,
        @NotNull Duration searchTimeout,
        @NotNull Duration snapshotTimeout,
        @Min(1) int excerptLength,
        @NotNull Duration shutdownGrace) {

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }
}
