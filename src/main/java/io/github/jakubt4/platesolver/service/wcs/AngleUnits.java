package io.github.jakubt4.platesolver.service.wcs;

/**
 * Angle conversions. WCS arithmetic stays in degrees; these are applied once,
 * where a value leaves that domain.
 */
public final class AngleUnits {

    public static final double ARCMINUTES_PER_DEGREE = 60.0;
    public static final double ARCSECONDS_PER_DEGREE = 3600.0;

    private AngleUnits() {
    }

    public static double degreesToArcminutes(final double degrees) {
        return degrees * ARCMINUTES_PER_DEGREE;
    }

    public static double degreesToArcseconds(final double degrees) {
        return degrees * ARCSECONDS_PER_DEGREE;
    }

    public static double arcsecondsToDegrees(final double arcseconds) {
        return arcseconds / ARCSECONDS_PER_DEGREE;
    }
}
