package io.github.jakubt4.platesolver.service.solver;

/**
 * Classified failure of a solver invocation.
 *
 * <p>"No solution found" is deliberately absent: a solver that runs to completion
 * without a match yields an unsolved {@link SolveResult} with no error kind.
 */
public enum SolveErrorKind {

    /** Requested executable is not on the astrometry.net allowlist. */
    INVALID_BINARY,

    /** Executable missing or not runnable on this host. */
    LAUNCH_FAILURE,

    /** Solver exceeded its deadline or the caller cancelled the wait. */
    TIMEOUT,

    /** Solver reported success but its WCS sidecar could not be read. */
    PARSE_FAILURE
}
