package io.github.jakubt4.platesolver.service.solver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}.
 *
 * <p>Executables are looked up on {@code PATH} unless {@code astrometry.bin-dir}
 * names the directory they are installed in.
 */
@Slf4j
@Component
public class SystemProcessLauncher implements ProcessLauncher {

    private final String binDir;

    public SystemProcessLauncher(@Value("${astrometry.bin-dir:}") final String binDir) {
        this.binDir = binDir == null ? "" : binDir.trim();
    }

    @Override
    public Process start(final AstrometryBinary binary, final List<String> arguments,
                         final Path workingDirectory) throws IOException {
        final var command = new ArrayList<String>(arguments.size() + 1);
        command.add(resolve(binary));
        command.addAll(arguments);

        final var builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        log.debug("Launching {} with {} argument(s)", command.get(0), arguments.size());
        return builder.start();
    }

    private String resolve(final AstrometryBinary binary) {
        if (binDir.isEmpty()) {
            return binary.executable();
        }
        return Path.of(binDir).resolve(binary.executable()).toString();
    }
}
