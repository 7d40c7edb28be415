package io.github.jakubt4.platesolver.service.solver;

public class InvalidBinaryException extends AstrometryException {

    public InvalidBinaryException(final String name) {
        super(SolveErrorKind.INVALID_BINARY, "invalid binary name: " + name);
    }
}
