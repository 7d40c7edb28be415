package io.github.jakubt4.platesolver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.jakubt4.platesolver.service.analysis.FieldOfView;
import io.github.jakubt4.platesolver.service.analysis.ImageAnalysis;
import io.github.jakubt4.platesolver.service.solver.ScaleUnits;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Body of {@code POST /analyse}. Absent fields are omitted from the JSON.
 */
@Schema(description = "Camera details and recommended solve scale bounds read from EXIF")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyseResponse(
        @Schema(description = "Whether the image could be analysed") boolean success,
        @Schema(description = "Camera manufacturer", example = "Canon") String make,
        @Schema(description = "Camera model", example = "Canon EOS 80D") String model,
        @Schema(description = "Focal length, millimetres", example = "50") Double focalLength,
        @Schema(description = "EXIF tags the sensor geometry came from", example = "35mm_equivalent")
        String detectedFrom,
        @Schema(description = "Field of view of the frame") Fov fov,
        @Schema(description = "Suggested scale_low for /solve", example = "1217.3") Double scaleLow,
        @Schema(description = "Suggested scale_high for /solve", example = "1826.0") Double scaleHigh,
        @Schema(description = "Units of the suggested bounds", example = "arcminwidth") String scaleUnits,
        @Schema(description = "Whether the image carried EXIF metadata") boolean hasExif,
        @Schema(description = "Failure reason") String error) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Fov(
            double widthDegrees,
            double heightDegrees,
            double widthArcmin,
            double heightArcmin,
            double diagonalDegrees) {

        static Fov from(final FieldOfView fieldOfView) {
            return new Fov(fieldOfView.widthDegrees(), fieldOfView.heightDegrees(),
                    fieldOfView.widthArcmin(), fieldOfView.heightArcmin(), fieldOfView.diagonalDegrees());
        }
    }

    public static AnalyseResponse from(final ImageAnalysis analysis) {
        final var fov = analysis.fieldOfView() == null ? null : Fov.from(analysis.fieldOfView());
        return new AnalyseResponse(true, analysis.make(), analysis.model(), analysis.focalLength(),
                analysis.detectedFrom(), fov, analysis.scaleLow(), analysis.scaleHigh(),
                ScaleUnits.ARCMINUTES_WIDTH.flagValue(), analysis.hasExif(), null);
    }

    public static AnalyseResponse error(final String message) {
        return new AnalyseResponse(false, null, null, null, null, null, null, null, null, false, message);
    }
}
