package io.github.jakubt4.platesolver.service.wcs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Derives a typed {@link WcsSolution} from a solve-field WCS sidecar.
 *
 * <p>The linear transform is taken from the {@code CD} matrix, or from
 * {@code CDELT1}/{@code CDELT2}/{@code CROTA2} when no {@code CD} keys are present:
 * <pre>
 *   pixelScale = sqrt(|CD1_1 * CD2_2 - CD1_2 * CD2_1|)   deg/pixel, then to arcsec/pixel
 *   parity     = sign(det CD)
 *   rotation   = -atan2(parity * CD2_1 - CD1_2, parity * CD1_1 + CD2_2)   degrees
 *   fieldWidth = pixelScale * width                        arcsec, then to degrees
 * </pre>
 * The rotation is solve-field's "up is N degrees E of N", so a header carrying only
 * {@code CROTA2} reports the negated {@code CROTA2}.
 * Image size comes from {@code IMAGEW}/{@code IMAGEH}, then {@code NAXIS1}/{@code NAXIS2},
 * then the staged image itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WcsSolutionExtractor {

    private static final String[] CD_KEYS = {"CD1_1", "CD1_2", "CD2_1", "CD2_2"};

    private final WcsHeaderParser headerParser;
    private final ImageDimensionProbe dimensionProbe;

    /**
     * @param sidecar WCS header written by solve-field
     * @param image   the solved image, probed only when the header carries no size
     * @throws WcsParseException if the header is unreadable or lacks a required key
     */
    public WcsSolution extract(final Path sidecar, final Path image) {
        final var header = headerParser.parse(sidecar);

        final var ra = requireDouble(header, "CRVAL1");
        final var dec = requireDouble(header, "CRVAL2");
        final var cd = linearTransform(header);

        final var determinant = cd[0] * cd[3] - cd[1] * cd[2];
        if (determinant == 0.0) {
            throw new WcsParseException("WCS transform is singular");
        }
        final var pixelScale = AngleUnits.degreesToArcseconds(Math.sqrt(Math.abs(determinant)));
        final var rotation = orientation(cd, determinant);

        final var size = imageSize(header, image)
                .orElseThrow(() -> new WcsParseException("image dimensions not in WCS header and not readable from image"));
        final var fieldWidth = AngleUnits.arcsecondsToDegrees(pixelScale * size.width());
        final var fieldHeight = AngleUnits.arcsecondsToDegrees(pixelScale * size.height());

        log.debug("WCS solution — ra={}, dec={}, scale={} arcsec/px, rotation={} deg, size={}x{}",
                ra, dec, pixelScale, rotation, size.width(), size.height());
        return new WcsSolution(ra, dec, pixelScale, rotation, fieldWidth, fieldHeight, header);
    }

    private static double[] linearTransform(final Map<String, String> header) {
        var hasCd = false;
        for (final var key : CD_KEYS) {
            hasCd |= header.containsKey(key);
        }
        if (hasCd) {
            final var cd = new double[CD_KEYS.length];
            for (var i = 0; i < CD_KEYS.length; i++) {
                cd[i] = requireDouble(header, CD_KEYS[i]);
            }
            return cd;
        }

        if (!header.containsKey("CDELT1") && !header.containsKey("CDELT2")) {
            throw new WcsParseException("WCS header has neither CD matrix nor CDELT keys");
        }
        final var cdelt1 = requireDouble(header, "CDELT1");
        final var cdelt2 = requireDouble(header, "CDELT2");
        final var crota = Math.toRadians(optionalDouble(header, "CROTA2").orElse(0.0));
        final var cos = Math.cos(crota);
        final var sin = Math.sin(crota);
        return new double[]{cdelt1 * cos, -cdelt2 * sin, cdelt1 * sin, cdelt2 * cos};
    }

    private Optional<ImageDimensions> imageSize(final Map<String, String> header, final Path image) {
        final var fromImageKeys = dimensions(header, "IMAGEW", "IMAGEH");
        if (fromImageKeys.isPresent()) {
            return fromImageKeys;
        }
        final var fromAxes = dimensions(header, "NAXIS1", "NAXIS2");
        if (fromAxes.isPresent()) {
            return fromAxes;
        }
        return dimensionProbe.probe(image);
    }

    private static Optional<ImageDimensions> dimensions(final Map<String, String> header,
                                                        final String widthKey, final String heightKey) {
        final var width = optionalDouble(header, widthKey);
        final var height = optionalDouble(header, heightKey);
        if (width.isEmpty() || height.isEmpty() || width.get() <= 0 || height.get() <= 0) {
            return Optional.empty();
        }
        return Optional.of(new ImageDimensions((int) Math.round(width.get()), (int) Math.round(height.get())));
    }

    private static double requireDouble(final Map<String, String> header, final String key) {
        return optionalDouble(header, key)
                .orElseThrow(() -> new WcsParseException("WCS header is missing " + key));
    }

    private static Optional<Double> optionalDouble(final Map<String, String> header, final String key) {
        final var raw = header.get(key);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            // FITS permits a D exponent
            final var value = Double.parseDouble(raw.strip().toUpperCase(Locale.ROOT).replace('D', 'E'));
            if (!Double.isFinite(value)) {
                throw new WcsParseException("WCS key " + key + " is not finite: " + raw);
            }
            return Optional.of(value);
        } catch (final NumberFormatException e) {
            throw new WcsParseException("WCS key " + key + " is not numeric: " + raw, e);
        }
    }

    private static double orientation(final double[] cd, final double determinant) {
        final var parity = determinant >= 0 ? 1.0 : -1.0;
        final var t = parity * cd[0] + cd[3];
        final var a = parity * cd[2] - cd[1];
        return normalise(-Math.toDegrees(Math.atan2(a, t)));
    }

    private static double normalise(final double degrees) {
        final var wrapped = degrees <= -180.0 ? degrees + 360.0 : degrees;
        return wrapped + 0.0;
    }
}
