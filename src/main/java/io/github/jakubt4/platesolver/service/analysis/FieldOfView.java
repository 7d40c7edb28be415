package io.github.jakubt4.platesolver.service.analysis;

import io.github.jakubt4.platesolver.service.wcs.AngleUnits;

/**
 * Angular extent of a frame taken through a rectilinear lens.
 *
 * @param widthDegrees    horizontal extent, along the image width
 * @param heightDegrees   vertical extent
 * @param widthArcmin     {@code widthDegrees} in arcminutes
 * @param heightArcmin    {@code heightDegrees} in arcminutes
 * @param diagonalDegrees corner-to-corner extent
 */
public record FieldOfView(
        double widthDegrees,
        double heightDegrees,
        double widthArcmin,
        double heightArcmin,
        double diagonalDegrees) {

    /**
     * @param sensorWidthMm  imaged area width, along the image width
     * @param sensorHeightMm imaged area height
     * @param focalLengthMm  focal length in the same frame of reference as the sensor size
     */
    public static FieldOfView of(final double sensorWidthMm, final double sensorHeightMm,
                                 final double focalLengthMm) {
        if (sensorWidthMm <= 0 || sensorHeightMm <= 0 || focalLengthMm <= 0) {
            throw new IllegalArgumentException("sensor size and focal length must be positive");
        }
        final var width = angle(sensorWidthMm, focalLengthMm);
        final var height = angle(sensorHeightMm, focalLengthMm);
        final var diagonal = angle(Math.hypot(sensorWidthMm, sensorHeightMm), focalLengthMm);
        return new FieldOfView(width, height,
                AngleUnits.degreesToArcminutes(width), AngleUnits.degreesToArcminutes(height), diagonal);
    }

    private static double angle(final double extentMm, final double focalLengthMm) {
        return Math.toDegrees(2 * Math.atan(extentMm / (2 * focalLengthMm)));
    }
}
