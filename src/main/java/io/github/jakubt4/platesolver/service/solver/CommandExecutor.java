package io.github.jakubt4.platesolver.service.solver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an astrometry.net companion tool by name and returns its output.
 *
 * <p>The name is checked against the allowlist before anything is launched.
 * Argument values are passed as a vector without a shell and are not otherwise
 * validated here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandExecutor {

    private final BoundedProcessRunner processRunner;

    /**
     * @throws InvalidBinaryException if {@code binaryName} is not allowlisted; no process is started
     * @throws AstrometryException    with {@link SolveErrorKind#LAUNCH_FAILURE} or
     *                                {@link SolveErrorKind#TIMEOUT}
     */
    public CommandOutput execute(final String binaryName, final Duration timeout, final String... arguments) {
        return execute(BinaryGuard.authorize(binaryName), timeout, arguments);
    }

    public CommandOutput execute(final AstrometryBinary binary, final Duration timeout, final String... arguments) {
        final ProcessOutcome outcome;
        try {
            outcome = processRunner.run(binary, List.of(arguments), null, timeout);
        } catch (final IOException e) {
            log.error("[{}] Failed to launch: {}", binary.executable(), e.getMessage());
            throw new AstrometryException(SolveErrorKind.LAUNCH_FAILURE,
                    "failed to launch " + binary.executable() + ": " + e.getMessage(), e);
        }

        if (outcome.status() != ProcessOutcome.Status.EXITED) {
            throw new AstrometryException(SolveErrorKind.TIMEOUT,
                    binary.executable() + " did not finish within " + timeout.toMillis() + " ms");
        }
        return new CommandOutput(outcome.exitCode(), outcome.output().strip());
    }
}
