package io.github.jakubt4.platesolver.controller;

import java.util.Locale;

final class UploadNames {

    private UploadNames() {
    }

    /** Lower-case extension with its leading dot, or empty when the name has none. */
    static String extension(final String filename) {
        if (filename == null) {
            return "";
        }
        final var dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
