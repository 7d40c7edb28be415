package io.github.jakubt4.platesolver.service.wcs;

/**
 * Image size in pixels.
 */
public record ImageDimensions(int width, int height) {
}
