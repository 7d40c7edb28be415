package io.github.jakubt4.platesolver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param status        always {@code "healthy"} while the service answers
 * @param uptimeSeconds seconds since the service started
 * @param version       API version
 */
public record HealthResponse(String status, @JsonProperty("uptime_seconds") double uptimeSeconds, String version) {
}
