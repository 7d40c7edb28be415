package io.github.jakubt4.platesolver.controller;

import io.github.jakubt4.platesolver.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;

@RestController
@Tag(name = "Health", description = "Server health and status")
public class HealthController {

    private final Instant startedAt = Instant.now();
    private final String version;

    public HealthController(@Value("${astrometry.api-version:0.1.0}") final String version) {
        this.version = version;
    }

    @Operation(summary = "Service health and uptime")
    @GetMapping("/health")
    public HealthResponse health() {
        final var uptime = Duration.between(startedAt, Instant.now()).toMillis() / 1000.0;
        return new HealthResponse("healthy", uptime, version);
    }
}
