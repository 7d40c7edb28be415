package io.github.jakubt4.platesolver.service.solver;

import io.github.jakubt4.platesolver.service.wcs.WcsSolution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one solve-field invocation.
 *
 * <p>Coordinate fields and {@code wcsHeader} are non-null exactly when {@code solved}
 * is true. {@code solveTime} and {@code rawOutput} are always present so an unsolved
 * or failed run can still be diagnosed from the solver's own log.
 *
 * @param solved       whether a WCS solution was produced and read
 * @param ra           field centre right ascension, degrees
 * @param dec          field centre declination, degrees
 * @param pixelScale   arcseconds per pixel
 * @param rotation     field rotation, degrees east of north
 * @param fieldWidth   field width, degrees
 * @param fieldHeight  field height, degrees
 * @param wcsHeader    every key of the WCS sidecar, verbatim and in file order
 * @param solveTime    wall-clock seconds spent on the run
 * @param rawOutput    combined stdout/stderr of the solver
 * @param errorKind    classified failure, {@code null} when solved or when no solution was found
 * @param errorMessage detail for {@code errorKind}
 */
public record SolveResult(
        boolean solved,
        Double ra,
        Double dec,
        Double pixelScale,
        Double rotation,
        Double fieldWidth,
        Double fieldHeight,
        Map<String, String> wcsHeader,
        double solveTime,
        String rawOutput,
        SolveErrorKind errorKind,
        String errorMessage) {

    public SolveResult {
        rawOutput = rawOutput == null ? "" : rawOutput;
        wcsHeader = wcsHeader == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(wcsHeader));
    }

    public static SolveResult solved(final WcsSolution solution, final double solveTime, final String rawOutput) {
        return new SolveResult(true, solution.ra(), solution.dec(), solution.pixelScale(), solution.rotation(),
                solution.fieldWidth(), solution.fieldHeight(), solution.header(), solveTime, rawOutput, null, null);
    }

    /** The solver ran to completion and found no match. Not an error. */
    public static SolveResult unsolved(final double solveTime, final String rawOutput) {
        return new SolveResult(false, null, null, null, null, null, null, null, solveTime, rawOutput, null, null);
    }

    public static SolveResult failed(final SolveErrorKind kind, final String message,
                                     final double solveTime, final String rawOutput) {
        return new SolveResult(false, null, null, null, null, null, null, null, solveTime, rawOutput, kind, message);
    }
}
