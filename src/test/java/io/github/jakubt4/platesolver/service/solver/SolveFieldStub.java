package io.github.jakubt4.platesolver.service.solver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Installs {@code /bin/sh} scripts named {@code solve-field} into a test bin directory.
 *
 * <p>Every script starts with {@code input} set to the last argument and {@code base}
 * to the input path without its extension, matching how solve-field names its outputs.
 */
public final class SolveFieldStub {

    private static final String PRELUDE = """
            #!/bin/sh
            for arg in "$@"; do input="$arg"; done
            base="${input%.*}"
            """;

    private SolveFieldStub() {
    }

    public static Path install(final Path binDir, final String body) throws IOException {
        final var script = binDir.resolve(AstrometryBinary.SOLVE_FIELD.executable());
        Files.writeString(script, PRELUDE + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    /** Script that writes {@code fixture} as the WCS sidecar plus a few byproducts and exits 0. */
    public static Path installSolving(final Path binDir, final String fixture) throws IOException {
        final var wcs = copyFixture(binDir, fixture);
        return install(binDir, """
                echo "Field 1: solved with index index-4107.fits."
                cp '%s' "$base.wcs"
                touch "$base.solved" "$base.axy" "$base.corr" "$base.match" "$base.rdls"
                """.formatted(wcs));
    }

    public static Path copyFixture(final Path dir, final String resource) {
        final var target = dir.resolve(Path.of(resource).getFileName().toString());
        try (InputStream in = SolveFieldStub.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No test resource " + resource);
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
