package io.github.jakubt4.platesolver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.jakubt4.platesolver.service.solver.SolveErrorKind;
import io.github.jakubt4.platesolver.service.solver.SolveResult;

import java.util.Map;

/**
 * Body of {@code POST /solve}. Absent fields are omitted from the JSON.
 *
 * @param solved      whether a solution was found
 * @param ra          field centre right ascension, degrees
 * @param dec         field centre declination, degrees
 * @param pixelScale  arcseconds per pixel
 * @param rotation    degrees east of north
 * @param fieldWidth  degrees
 * @param fieldHeight degrees
 * @param wcsHeader   raw WCS keys from the solver
 * @param solveTime   seconds spent solving
 * @param rawOutput   solver log, useful when {@code solved} is false
 * @param error       human-readable failure reason
 * @param errorKind   classified failure, when the solver itself failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResponse(
        boolean solved,
        Double ra,
        Double dec,
        Double pixelScale,
        Double rotation,
        Double fieldWidth,
        Double fieldHeight,
        Map<String, String> wcsHeader,
        Double solveTime,
        String rawOutput,
        String error,
        SolveErrorKind errorKind) {

    public static SolveResponse from(final SolveResult result) {
        return new SolveResponse(result.solved(), result.ra(), result.dec(), result.pixelScale(),
                result.rotation(), result.fieldWidth(), result.fieldHeight(), result.wcsHeader(),
                result.solveTime(), result.rawOutput(), result.errorMessage(), result.errorKind());
    }

    public static SolveResponse error(final String message) {
        return new SolveResponse(false, null, null, null, null, null, null, null, null, null, message, null);
    }
}
