package io.github.jakubt4.platesolver.service.solver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryGuardTest {

    @Test
    void authorizesEveryAllowlistedExecutable() {
        assertThat(BinaryGuard.authorize("solve-field")).isEqualTo(AstrometryBinary.SOLVE_FIELD);
        assertThat(BinaryGuard.authorize("image2xy")).isEqualTo(AstrometryBinary.IMAGE2XY);
        assertThat(BinaryGuard.authorize("fit-wcs")).isEqualTo(AstrometryBinary.FIT_WCS);
        assertThat(BinaryGuard.authorize("wcs-xy2rd")).isEqualTo(AstrometryBinary.WCS_XY2RD);
        assertThat(BinaryGuard.authorize("wcs-rd2xy")).isEqualTo(AstrometryBinary.WCS_RD2XY);
    }

    @Test
    void allowlistHasExactlyFiveEntries() {
        assertThat(AstrometryBinary.values()).hasSize(5);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "invalid-binary", "rm", "bash", "python", "", " solve-field", "solve-field ",
            "SOLVE-FIELD", "../solve-field", "/usr/bin/solve-field", "solve-field; rm -rf /",
            "solve", "solve-field2", "wcs-"
    })
    void rejectsAnythingButAnExactMatch(final String name) {
        assertThatThrownBy(() -> BinaryGuard.authorize(name))
                .isInstanceOf(InvalidBinaryException.class)
                .hasMessageContaining("invalid binary name")
                .satisfies(e -> assertThat(((AstrometryException) e).kind()).isEqualTo(SolveErrorKind.INVALID_BINARY));
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> BinaryGuard.authorize(null))
                .isInstanceOf(InvalidBinaryException.class);
    }
}
