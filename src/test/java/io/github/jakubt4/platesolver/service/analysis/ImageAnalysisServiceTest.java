package io.github.jakubt4.platesolver.service.analysis;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ImageAnalysisServiceTest {

    private final ImageAnalysisService service = new ImageAnalysisService();

    @Test
    void cropCameraUsesThirtyFiveMillimetreEquivalent() throws Exception {
        final var jpeg = ExifJpegFixture.camera("Canon", "Canon EOS 80D")
                .focalLength(50)
                .focalLengthIn35mmFilm(80)
                .jpeg();

        final var analysis = service.analyse(new ByteArrayInputStream(jpeg));

        assertThat(analysis.make()).isEqualTo("Canon");
        assertThat(analysis.model()).isEqualTo("Canon EOS 80D");
        assertThat(analysis.focalLength()).isEqualTo(50.0);
        assertThat(analysis.hasExif()).isTrue();
        assertThat(analysis.detectedFrom()).isEqualTo(ImageAnalysisService.FROM_35MM_EQUIVALENT);
        assertThat(analysis.fieldOfView().widthDegrees()).isCloseTo(25.3608, within(1e-4));
        assertThat(analysis.fieldOfView().heightDegrees()).isCloseTo(17.0615, within(1e-4));
        assertThat(analysis.fieldOfView().diagonalDegrees()).isCloseTo(30.2636, within(1e-4));
        assertThat(analysis.scaleLow()).isCloseTo(1521.646 * 0.8, within(1e-2));
        assertThat(analysis.scaleHigh()).isCloseTo(1521.646 * 1.2, within(1e-2));
    }

    @Test
    void focalPlaneResolutionWinsOverEquivalentFocalLength() throws Exception {
        // 6000 px at 250 px/mm is a 24 x 16 mm sensor
        final var jpeg = ExifJpegFixture.camera("NIKON CORPORATION", "NIKON D7500")
                .focalLength(24)
                .focalLengthIn35mmFilm(36)
                .exifImageSize(6000, 4000)
                .focalPlaneResolution(250, 4)
                .jpeg();

        final var analysis = service.analyse(new ByteArrayInputStream(jpeg));

        assertThat(analysis.detectedFrom()).isEqualTo(ImageAnalysisService.FROM_FOCAL_PLANE);
        assertThat(analysis.fieldOfView().widthDegrees()).isCloseTo(53.1301, within(1e-3));
        assertThat(analysis.fieldOfView().heightDegrees()).isCloseTo(36.8699, within(1e-3));
        assertThat(analysis.scaleLow()).isCloseTo(2550.245, within(1e-1));
        assertThat(analysis.scaleHigh()).isCloseTo(3825.367, within(1e-1));
    }

    @Test
    void portraitFrameSwapsTheEquivalentSensorAxes() throws Exception {
        final var jpeg = ExifJpegFixture.camera("Apple", "iPhone 13")
                .focalLengthIn35mmFilm(50)
                .exifImageSize(3024, 4032)
                .jpeg();

        final var analysis = service.analyse(new ByteArrayInputStream(jpeg));

        assertThat(analysis.focalLength()).isEqualTo(50.0);
        assertThat(analysis.fieldOfView().widthDegrees()).isCloseTo(26.9915, within(1e-4));
        assertThat(analysis.fieldOfView().heightDegrees()).isCloseTo(39.5978, within(1e-4));
    }

    @Test
    void exifWithoutOpticsHasNoFieldOfView() throws Exception {
        final var jpeg = ExifJpegFixture.camera("Canon", "Canon EOS 6D").jpeg();

        final var analysis = service.analyse(new ByteArrayInputStream(jpeg));

        assertThat(analysis.hasExif()).isTrue();
        assertThat(analysis.make()).isEqualTo("Canon");
        assertThat(analysis.focalLength()).isNull();
        assertThat(analysis.fieldOfView()).isNull();
        assertThat(analysis.detectedFrom()).isNull();
        assertThat(analysis.scaleLow()).isNull();
        assertThat(analysis.scaleHigh()).isNull();
    }

    @Test
    void jpegWithoutExifIsRejected() throws Exception {
        final var jpeg = ExifJpegFixture.plainJpeg();

        assertThatThrownBy(() -> service.analyse(new ByteArrayInputStream(jpeg)))
                .isInstanceOf(ImageAnalysisException.class)
                .hasMessage("no EXIF data found");
    }

    @Test
    void unrecognisedBytesAreRejected() {
        assertThatThrownBy(() -> service.analyse(new ByteArrayInputStream(new byte[]{1, 2, 3, 4, 5, 6, 7, 8})))
                .isInstanceOf(ImageAnalysisException.class)
                .hasMessageStartingWith("unrecognised image");
    }
}
