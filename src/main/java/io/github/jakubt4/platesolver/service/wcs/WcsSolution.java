package io.github.jakubt4.platesolver.service.wcs;

import java.util.Map;

/**
 * Typed fields derived from a solve-field WCS sidecar.
 *
 * @param ra          CRVAL1, degrees
 * @param dec         CRVAL2, degrees
 * @param pixelScale  arcseconds per pixel
 * @param rotation    degrees, in (-180, 180]
 * @param fieldWidth  degrees
 * @param fieldHeight degrees
 * @param header      raw key/value mapping the fields were derived from
 */
public record WcsSolution(
        double ra,
        double dec,
        double pixelScale,
        double rotation,
        double fieldWidth,
        double fieldHeight,
        Map<String, String> header) {
}
