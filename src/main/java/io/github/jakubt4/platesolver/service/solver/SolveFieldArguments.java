package io.github.jakubt4.platesolver.service.solver;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates {@link SolveOptions} into solve-field flags.
 *
 * <p>Every populated field yields exactly one flag and value; absent fields yield
 * nothing. The two depth bounds share the single {@code --depth} flag, which takes
 * a range. {@code keepTempFiles} is handled by staging and has no flag.
 */
public final class SolveFieldArguments {

    private SolveFieldArguments() {
    }

    public static List<String> translate(final SolveOptions options) {
        final var args = new ArrayList<String>();
        addFlag(args, "--scale-low", options.scaleLow());
        addFlag(args, "--scale-high", options.scaleHigh());
        if (options.scaleUnits() != null) {
            args.add("--scale-units");
            args.add(options.scaleUnits().flagValue());
        }
        if (options.downsampleFactor() != null) {
            args.add("--downsample");
            args.add(Integer.toString(options.downsampleFactor()));
        }
        final var depth = depthRange(options.depthLow(), options.depthHigh());
        if (depth != null) {
            args.add("--depth");
            args.add(depth);
        }
        addFlag(args, "--ra", options.ra());
        addFlag(args, "--dec", options.dec());
        addFlag(args, "--radius", options.radius());
        return List.copyOf(args);
    }

    private static void addFlag(final List<String> args, final String flag, final Double value) {
        if (value != null) {
            args.add(flag);
            // Double.toString is locale-independent
            args.add(Double.toString(value));
        }
    }

    private static String depthRange(final Integer low, final Integer high) {
        if (low != null && high != null) {
            return low + "-" + high;
        }
        if (low != null) {
            return Integer.toString(low);
        }
        return high == null ? null : Integer.toString(high);
    }
}
