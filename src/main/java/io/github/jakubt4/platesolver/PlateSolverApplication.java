package io.github.jakubt4.platesolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Plate Solver: HTTP front end for the astrometry.net {@code solve-field} engine.
 *
 * <p>Stages an uploaded sky image in a scratch directory, runs {@code solve-field}
 * against it under a hard deadline, and turns the WCS sidecar the solver writes
 * into a typed coordinate solution (centre RA/Dec, pixel scale, rotation, field size).
 *
 * @see io.github.jakubt4.platesolver.service.PlateSolveService
 * @see io.github.jakubt4.platesolver.service.solver.SolveFieldRunner
 */
@SpringBootApplication
public class PlateSolverApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlateSolverApplication.class, args);
    }
}
