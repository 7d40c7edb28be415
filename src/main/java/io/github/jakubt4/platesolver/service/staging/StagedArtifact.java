package io.github.jakubt4.platesolver.service.staging;

import io.github.jakubt4.platesolver.service.solver.SolverOutputs;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A staged upload and the solver byproducts that will be written beside it.
 *
 * <p>Owned by exactly one solve. Closing removes the input and every known
 * sibling; use it in try-with-resources so that happens on every exit path.
 * When created with {@code retain}, closing only logs the location and the files
 * become the caller's to clean up.
 */
@Slf4j
public final class StagedArtifact implements AutoCloseable {

    private final Path path;
    private final boolean retain;
    private final AtomicBoolean closed = new AtomicBoolean();

    StagedArtifact(final Path path, final boolean retain) {
        this.path = path;
        this.retain = retain;
    }

    /** The staged input file. */
    public Path path() {
        return path;
    }

    public boolean retained() {
        return retain;
    }

    /** The input followed by every sibling path a solver run may create. */
    public List<Path> artifacts() {
        final var artifacts = new ArrayList<Path>(SolverOutputs.SIBLING_SUFFIXES.size() + 1);
        artifacts.add(path);
        SolverOutputs.SIBLING_SUFFIXES.forEach(suffix -> artifacts.add(SolverOutputs.sibling(path, suffix)));
        return artifacts;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (retain) {
            log.info("[staging] Keeping temporary files for {}", path);
            return;
        }

        var removed = 0;
        for (final var artifact : artifacts()) {
            try {
                if (Files.deleteIfExists(artifact)) {
                    removed++;
                }
            } catch (final IOException e) {
                log.warn("[staging] Failed to remove {}: {}", artifact, e.getMessage());
            }
        }
        log.debug("[staging] Released {} ({} file(s) removed)", path.getFileName(), removed);
    }
}
