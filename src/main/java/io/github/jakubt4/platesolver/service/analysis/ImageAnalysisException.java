package io.github.jakubt4.platesolver.service.analysis;

/**
 * The upload is not an image with readable EXIF metadata.
 */
public class ImageAnalysisException extends RuntimeException {

    public ImageAnalysisException(final String message) {
        super(message);
    }

    public ImageAnalysisException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
