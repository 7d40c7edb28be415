package io.github.jakubt4.platesolver.service.solver;

/**
 * Base exception for failures around astrometry.net tool invocation.
 * Carries the {@link SolveErrorKind} the failure is reported as.
 */
public class AstrometryException extends RuntimeException {

    private final SolveErrorKind kind;

    public AstrometryException(final SolveErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public AstrometryException(final SolveErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SolveErrorKind kind() {
        return kind;
    }
}
