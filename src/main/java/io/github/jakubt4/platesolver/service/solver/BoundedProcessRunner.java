package io.github.jakubt4.platesolver.service.solver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one external process under a wall-clock deadline.
 *
 * <p>Output is drained on a background reader for the whole lifetime of the
 * process, so a solver that logs heavily cannot stall on a full pipe. When the
 * deadline passes, or the waiting thread is interrupted, the process and every
 * descendant it spawned are destroyed forcibly; the run never returns while the
 * launched process is still alive, short of the termination grace expiring.
 */
@Slf4j
@Component
public class BoundedProcessRunner {

    private static final Duration TERMINATION_GRACE = Duration.ofSeconds(5);
    private static final Duration DRAIN_GRACE = Duration.ofSeconds(2);

    private final ProcessLauncher processLauncher;
    private final ExecutorService outputExecutor;

    public BoundedProcessRunner(final ProcessLauncher processLauncher,
                                @Qualifier("solverOutputExecutor") final ExecutorService outputExecutor) {
        this.processLauncher = processLauncher;
        this.outputExecutor = outputExecutor;
    }

    /**
     * @throws IOException                if the process cannot be started
     * @throws RejectedExecutionException if the output executor no longer accepts work;
     *                                    the started process is destroyed first
     */
    public ProcessOutcome run(final AstrometryBinary binary, final List<String> arguments,
                              final Path workingDirectory, final Duration deadline) throws IOException {
        final var process = processLauncher.start(binary, arguments, workingDirectory);
        final var output = new ByteArrayOutputStream();
        final Future<?> drain;
        try {
            drain = outputExecutor.submit(() -> drain(process.getInputStream(), output));
        } catch (final RejectedExecutionException e) {
            log.error("[{}] Output reader rejected, terminating pid {}", binary.executable(), process.pid());
            terminate(process);
            throw e;
        }

        try {
            if (!process.waitFor(deadline.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Deadline of {} ms exceeded, terminating pid {}",
                        binary.executable(), deadline.toMillis(), process.pid());
                terminate(process);
                return ProcessOutcome.timedOut(awaitDrain(drain, output));
            }
            return ProcessOutcome.exited(process.exitValue(), awaitDrain(drain, output));
        } catch (final InterruptedException e) {
            log.warn("[{}] Wait interrupted, terminating pid {}", binary.executable(), process.pid());
            terminate(process);
            drain.cancel(true);
            Thread.currentThread().interrupt();
            return ProcessOutcome.cancelled(output.toString(StandardCharsets.UTF_8));
        }
    }

    private void drain(final InputStream stream, final ByteArrayOutputStream sink) {
        try (stream) {
            stream.transferTo(sink);
        } catch (final IOException e) {
            // stream is closed underneath the reader when the process is destroyed
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private String awaitDrain(final Future<?> drain, final ByteArrayOutputStream output) {
        try {
            drain.get(DRAIN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            // an orphaned grandchild can keep the pipe open after the process exits
            log.debug("Output still open after {} ms, returning captured text", DRAIN_GRACE.toMillis());
            drain.cancel(true);
        } catch (final ExecutionException e) {
            log.warn("Output reader failed: {}", e.getCause().getMessage());
        } catch (final InterruptedException e) {
            drain.cancel(true);
            Thread.currentThread().interrupt();
        }
        return output.toString(StandardCharsets.UTF_8);
    }

    private void terminate(final Process process) {
        // snapshot descendants first: once the parent dies they are re-parented and no longer listed
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(TERMINATION_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("pid {} still alive {} ms after forced termination",
                        process.pid(), TERMINATION_GRACE.toMillis());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
