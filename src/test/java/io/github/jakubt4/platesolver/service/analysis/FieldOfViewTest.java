package io.github.jakubt4.platesolver.service.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FieldOfViewTest {

    @Test
    void fiftyMillimetreLensOnFullFrame() {
        final var fov = FieldOfView.of(36.0, 24.0, 50.0);

        assertThat(fov.widthDegrees()).isCloseTo(39.5978, within(1e-4));
        assertThat(fov.heightDegrees()).isCloseTo(26.9915, within(1e-4));
        assertThat(fov.diagonalDegrees()).isCloseTo(46.7930, within(1e-4));
        assertThat(fov.widthArcmin()).isCloseTo(fov.widthDegrees() * 60, within(1e-9));
        assertThat(fov.heightArcmin()).isCloseTo(fov.heightDegrees() * 60, within(1e-9));
    }

    @Test
    void longerLensNarrowsTheField() {
        assertThat(FieldOfView.of(36.0, 24.0, 400.0).widthDegrees())
                .isLessThan(FieldOfView.of(36.0, 24.0, 200.0).widthDegrees());
    }

    @Test
    void nonPositiveInputsAreRejected() {
        assertThatThrownBy(() -> FieldOfView.of(36.0, 24.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldOfView.of(-1.0, 24.0, 50.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
