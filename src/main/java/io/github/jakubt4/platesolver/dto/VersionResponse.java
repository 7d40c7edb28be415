package io.github.jakubt4.platesolver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response of {@code GET /version}.
 *
 * @param version output of {@code solve-field --version}, {@code null} on failure
 * @param error   failure detail, {@code null} on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VersionResponse(String version, String error) {

    public static VersionResponse of(final String version) {
        return new VersionResponse(version, null);
    }

    public static VersionResponse failure(final String error) {
        return new VersionResponse(null, error);
    }
}
