package io.github.jakubt4.platesolver.service;

import io.github.jakubt4.platesolver.service.solver.SolveFieldRunner;
import io.github.jakubt4.platesolver.service.solver.SolveOptions;
import io.github.jakubt4.platesolver.service.solver.SolveResult;
import io.github.jakubt4.platesolver.service.staging.ArtifactStager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point for solving an uploaded image.
 *
 * <p>Stages the bytes in the scratch directory, runs solve-field on them and
 * releases every staged file before returning, whatever the outcome, unless
 * {@link SolveOptions#keepTempFiles()} is set.
 */
@Service
@RequiredArgsConstructor
public class PlateSolveService {

    private final ArtifactStager artifactStager;
    private final SolveFieldRunner solveFieldRunner;

    public SolveResult solve(final byte[] image, final String extension, final SolveOptions options) {
        return solve(image, extension, options, null);
    }

    /**
     * @param image     upload bytes
     * @param extension lower-case extension with leading dot, already validated by the caller
     * @param options   search parameters
     * @param deadline  caller's budget, {@code null} for the configured timeout
     * @throws java.io.UncheckedIOException if the upload cannot be written to the scratch directory
     */
    public SolveResult solve(final byte[] image, final String extension, final SolveOptions options,
                             final Duration deadline) {
        try (var staged = artifactStager.stage(image, extension, options.keepTempFiles())) {
            return solveFieldRunner.solve(staged.path(), options, deadline);
        }
    }
}
