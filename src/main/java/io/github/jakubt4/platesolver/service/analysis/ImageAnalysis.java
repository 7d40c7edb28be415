package io.github.jakubt4.platesolver.service.analysis;

/**
 * Camera details read from an image's EXIF block, with the field of view and
 * the solve-field scale bounds derived from them.
 *
 * <p>{@code fieldOfView}, {@code detectedFrom}, {@code scaleLow} and {@code scaleHigh}
 * are all present or all {@code null}: the EXIF block may not carry enough optics
 * to work out a field.
 *
 * @param make         camera manufacturer, if recorded
 * @param model        camera model, if recorded
 * @param focalLength  focal length in millimetres as recorded
 * @param hasExif      always true for a successful analysis
 * @param detectedFrom which EXIF tags the sensor geometry came from
 * @param fieldOfView  angular size of the frame
 * @param scaleLow     lower bound on the image width, arcminutes
 * @param scaleHigh    upper bound on the image width, arcminutes
 */
public record ImageAnalysis(
        String make,
        String model,
        Double focalLength,
        boolean hasExif,
        String detectedFrom,
        FieldOfView fieldOfView,
        Double scaleLow,
        Double scaleHigh) {
}
