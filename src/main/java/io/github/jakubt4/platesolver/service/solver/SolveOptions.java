package io.github.jakubt4.platesolver.service.solver;

import lombok.Builder;

/**
 * Search parameters for one solve-field run.
 *
 * <p>A {@code null} field is not passed to the solver, which then applies its own
 * default. {@link #builder()} starts from {@link #defaults()}.
 *
 * <p>{@code radius} is only meaningful together with {@code ra} and {@code dec}; an
 * incomplete hint is passed through unchanged and solve-field ignores it.
 *
 * @param scaleLow         lower bound on image scale, in {@code scaleUnits}
 * @param scaleHigh        upper bound on image scale, in {@code scaleUnits}
 * @param scaleUnits       units of the scale bounds
 * @param downsampleFactor positive downsample factor applied before source extraction
 * @param depthLow         first quad depth tried
 * @param depthHigh        last quad depth tried
 * @param ra               right ascension hint, degrees J2000
 * @param dec              declination hint, degrees J2000
 * @param radius           search radius around the hint, degrees
 * @param keepTempFiles    leave staged files on disk after the run
 */
@Builder(toBuilder = true)
public record SolveOptions(
        Double scaleLow,
        Double scaleHigh,
        ScaleUnits scaleUnits,
        Integer downsampleFactor,
        Integer depthLow,
        Integer depthHigh,
        Double ra,
        Double dec,
        Double radius,
        boolean keepTempFiles) {

    public static final ScaleUnits DEFAULT_SCALE_UNITS = ScaleUnits.ARCMINUTES_WIDTH;
    public static final int DEFAULT_DOWNSAMPLE_FACTOR = 2;
    public static final int DEFAULT_DEPTH_LOW = 10;
    public static final int DEFAULT_DEPTH_HIGH = 20;

    public SolveOptions {
        requirePositive("downsampleFactor", downsampleFactor);
        requirePositive("depthLow", depthLow);
        requirePositive("depthHigh", depthHigh);
    }

    public static SolveOptions defaults() {
        return new SolveOptions(null, null, DEFAULT_SCALE_UNITS, DEFAULT_DOWNSAMPLE_FACTOR,
                DEFAULT_DEPTH_LOW, DEFAULT_DEPTH_HIGH, null, null, null, false);
    }

    public static SolveOptionsBuilder builder() {
        return defaults().toBuilder();
    }

    private static void requirePositive(final String name, final Integer value) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
