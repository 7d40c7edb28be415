package io.github.jakubt4.platesolver.controller;

import io.github.jakubt4.platesolver.dto.VersionResponse;
import io.github.jakubt4.platesolver.service.solver.AstrometryBinary;
import io.github.jakubt4.platesolver.service.solver.AstrometryException;
import io.github.jakubt4.platesolver.service.solver.CommandExecutor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Reports the version of the installed solve-field binary.
 *
 * <p>Failures are reported in the body with {@code 200 OK}; the endpoint doubles as
 * a probe for whether the solver is installed at all.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class VersionController {

    private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(10);

    private final CommandExecutor commandExecutor;

    @Operation(summary = "Installed solve-field version")
    @GetMapping("/version")
    public VersionResponse version() {
        try {
            final var result = commandExecutor.execute(AstrometryBinary.SOLVE_FIELD, VERSION_TIMEOUT, "--version");
            if (!result.succeeded()) {
                return VersionResponse.failure(
                        "solve-field exited with status " + result.exitCode() + ": " + result.output());
            }
            return VersionResponse.of(result.output());
        } catch (final AstrometryException e) {
            log.warn("solve-field version probe failed [{}]: {}", e.kind(), e.getMessage());
            return VersionResponse.failure(e.getMessage());
        }
    }
}
