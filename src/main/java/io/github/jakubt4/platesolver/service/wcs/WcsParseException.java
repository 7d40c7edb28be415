package io.github.jakubt4.platesolver.service.wcs;

import io.github.jakubt4.platesolver.service.solver.AstrometryException;
import io.github.jakubt4.platesolver.service.solver.SolveErrorKind;

public class WcsParseException extends AstrometryException {

    public WcsParseException(final String message) {
        super(SolveErrorKind.PARSE_FAILURE, message);
    }

    public WcsParseException(final String message, final Throwable cause) {
        super(SolveErrorKind.PARSE_FAILURE, message, cause);
    }
}
