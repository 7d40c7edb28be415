package io.github.jakubt4.platesolver.service.solver;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of astrometry.net executables this service is permitted to run.
 *
 * <p>Anything that launches a process takes one of these constants, so an
 * unlisted program cannot be named from inside the service. Names arriving as
 * strings from outside go through {@link BinaryGuard#authorize(String)} first.
 */
public enum AstrometryBinary {

    SOLVE_FIELD("solve-field"),
    IMAGE2XY("image2xy"),
    FIT_WCS("fit-wcs"),
    WCS_XY2RD("wcs-xy2rd"),
    WCS_RD2XY("wcs-rd2xy");

    private static final Map<String, AstrometryBinary> BY_EXECUTABLE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(AstrometryBinary::executable, Function.identity()));

    private final String executable;

    AstrometryBinary(final String executable) {
        this.executable = executable;
    }

    /** File name of the executable as installed by astrometry.net. */
    public String executable() {
        return executable;
    }

    static Optional<AstrometryBinary> byExecutable(final String name) {
        return Optional.ofNullable(name).map(BY_EXECUTABLE::get);
    }
}
