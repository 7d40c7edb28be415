package io.github.jakubt4.platesolver.service.solver;

import java.nio.file.Path;
import java.util.List;

/**
 * Files solve-field writes next to its input, named after the input's base name.
 */
public final class SolverOutputs {

    public static final String WCS = ".wcs";
    public static final String CONFIG = ".cfg";

    /** Every sibling a run may leave behind, including the config written for it. */
    public static final List<String> SIBLING_SUFFIXES = List.of(
            WCS, CONFIG, ".solved", ".axy", ".corr", ".match", ".rdls", ".new", ".xyls",
            "-indx.xyls", "-objs.png", "-ngc.png", "-indx.png");

    private SolverOutputs() {
    }

    /** {@code /scratch/astro_1.png} with {@code ".wcs"} resolves to {@code /scratch/astro_1.wcs}. */
    public static Path sibling(final Path input, final String suffix) {
        return input.resolveSibling(baseName(input) + suffix);
    }

    public static String baseName(final Path input) {
        final var fileName = input.getFileName().toString();
        final var dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
