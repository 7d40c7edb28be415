package io.github.jakubt4.platesolver.service.staging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Writes uploads into the scratch directory under a name no other in-flight solve can hold.
 *
 * <p>Names are {@code astro_<pid>_<random><ext>} and files are created with
 * {@link StandardOpenOption#CREATE_NEW}. An existing file at the chosen path means
 * the uniqueness invariant is broken and staging fails with {@link IllegalStateException}
 * rather than overwrite another solve's input.
 *
 * <p>The scratch directory must already exist and be writable.
 */
@Slf4j
@Component
public class ArtifactStager {

    private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,8}");

    private final Path scratchDir;
    private final Supplier<String> uniqueToken;

    @Autowired
    public ArtifactStager(@Value("${astrometry.scratch-dir}") final Path scratchDir) {
        this(scratchDir, () -> UUID.randomUUID().toString());
    }

    ArtifactStager(final Path scratchDir, final Supplier<String> uniqueToken) {
        this.scratchDir = scratchDir;
        this.uniqueToken = uniqueToken;
    }

    public StagedArtifact stage(final byte[] content, final String extension) {
        return stage(content, extension, false);
    }

    /**
     * @param content   upload bytes
     * @param extension extension including the dot, e.g. {@code ".fits"}
     * @param retain    leave the files in place when the artifact is closed
     * @throws IllegalArgumentException if the extension is not a short alphanumeric suffix
     * @throws IllegalStateException    if the generated path already exists
     * @throws UncheckedIOException     if the file cannot be written
     */
    public StagedArtifact stage(final byte[] content, final String extension, final boolean retain) {
        if (extension == null || !EXTENSION.matcher(extension).matches()) {
            throw new IllegalArgumentException("Unsupported file extension: " + extension);
        }

        final var path = scratchDir.resolve(
                "astro_" + ProcessHandle.current().pid() + "_" + uniqueToken.get() + extension);
        try {
            Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (final FileAlreadyExistsException e) {
            throw new IllegalStateException("Staged path collision: " + path, e);
        } catch (final IOException e) {
            deleteQuietly(path, e);
            throw new UncheckedIOException("Failed to stage upload at " + path, e);
        }

        log.debug("[staging] Staged {} bytes at {}", content.length, path);
        return new StagedArtifact(path, retain);
    }

    private static void deleteQuietly(final Path path, final IOException cause) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }
}
