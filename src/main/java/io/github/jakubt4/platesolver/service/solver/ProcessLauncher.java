package io.github.jakubt4.platesolver.service.solver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts an allowlisted astrometry.net executable as an OS process.
 *
 * <p>Implementations must merge standard error into standard output so the
 * caller drains a single stream.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * @param binary           executable to run
     * @param arguments        argument vector, passed to the process without a shell
     * @param workingDirectory working directory, or {@code null} to inherit
     * @throws IOException if the executable cannot be found or started
     */
    Process start(AstrometryBinary binary, List<String> arguments, Path workingDirectory) throws IOException;
}
