package io.github.jakubt4.platesolver.service.solver;

import java.util.Arrays;
import java.util.Optional;

/** Units of the {@code --scale-low}/{@code --scale-high} bounds, as spelled by solve-field. */
public enum ScaleUnits {

    DEGREES_WIDTH("degwidth"),
    ARCMINUTES_WIDTH("arcminwidth"),
    ARCSECONDS_PER_PIXEL("arcsecperpix");

    private final String flagValue;

    ScaleUnits(final String flagValue) {
        this.flagValue = flagValue;
    }

    public String flagValue() {
        return flagValue;
    }

    public static Optional<ScaleUnits> fromFlagValue(final String value) {
        return Arrays.stream(values())
                .filter(units -> units.flagValue.equals(value))
                .findFirst();
    }
}
