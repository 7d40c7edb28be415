package io.github.jakubt4.platesolver.service.solver;

import io.github.jakubt4.platesolver.service.wcs.WcsParseException;
import io.github.jakubt4.platesolver.service.wcs.WcsSolutionExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@code solve-field} on a staged image and classifies what happened.
 *
 * <p>One call starts exactly one process and writes only next to the staged input:
 * a per-run config naming the index directory, and whatever solve-field produces.
 * Outcomes are returned, never thrown:
 * <ul>
 *   <li>WCS sidecar present after exit: solved, fields read by {@link WcsSolutionExtractor}</li>
 *   <li>exit without sidecar: unsolved, no error</li>
 *   <li>sidecar unreadable: {@link SolveErrorKind#PARSE_FAILURE}</li>
 *   <li>deadline passed or wait interrupted: process tree killed, {@link SolveErrorKind#TIMEOUT}</li>
 *   <li>executable could not start: {@link SolveErrorKind#LAUNCH_FAILURE}</li>
 * </ul>
 * Failed runs are not retried.
 */
@Slf4j
@Service
public class SolveFieldRunner {

    /** Hard ceiling on any single solve, whatever the caller or configuration asks for. */
    public static final Duration MAX_DEADLINE = Duration.ofMinutes(5);

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final BoundedProcessRunner processRunner;
    private final WcsSolutionExtractor solutionExtractor;
    private final String indexPath;
    private final Duration configuredTimeout;

    public SolveFieldRunner(final BoundedProcessRunner processRunner,
                            final WcsSolutionExtractor solutionExtractor,
                            @Value("${astrometry.index-path}") final String indexPath,
                            @Value("${astrometry.solve-timeout:5m}") final Duration configuredTimeout) {
        this.processRunner = processRunner;
        this.solutionExtractor = solutionExtractor;
        this.indexPath = indexPath;
        this.configuredTimeout = configuredTimeout;
    }

    public SolveResult solve(final Path stagedInput, final SolveOptions options) {
        return solve(stagedInput, options, null);
    }

    /**
     * @param stagedInput image already written to the scratch directory
     * @param options     search parameters
     * @param deadline    caller's budget, or {@code null} for the configured timeout;
     *                    never longer than {@link #MAX_DEADLINE}
     */
    public SolveResult solve(final Path stagedInput, final SolveOptions options, final Duration deadline) {
        final var effectiveDeadline = effectiveDeadline(deadline);
        final var startedAt = System.nanoTime();
        final var wcsFile = SolverOutputs.sibling(stagedInput, SolverOutputs.WCS);

        final List<String> arguments;
        try {
            arguments = arguments(stagedInput, options);
        } catch (final IOException e) {
            log.error("[solve-field] Cannot write solver config beside {}: {}", stagedInput, e.getMessage());
            return SolveResult.failed(SolveErrorKind.LAUNCH_FAILURE,
                    "failed to write solver config: " + e.getMessage(), elapsedSeconds(startedAt), "");
        }

        log.info("[solve-field] Solving {} (deadline {} ms)", stagedInput.getFileName(), effectiveDeadline.toMillis());
        final ProcessOutcome outcome;
        try {
            outcome = processRunner.run(AstrometryBinary.SOLVE_FIELD, arguments,
                    stagedInput.getParent(), effectiveDeadline);
        } catch (final IOException e) {
            log.error("[solve-field] Failed to launch: {}", e.getMessage());
            return SolveResult.failed(SolveErrorKind.LAUNCH_FAILURE,
                    "failed to launch solve-field: " + e.getMessage(), elapsedSeconds(startedAt), "");
        }

        return classify(outcome, wcsFile, stagedInput, effectiveDeadline, startedAt);
    }

    private SolveResult classify(final ProcessOutcome outcome, final Path wcsFile, final Path stagedInput,
                                 final Duration deadline, final long startedAt) {
        if (outcome.status() == ProcessOutcome.Status.TIMED_OUT) {
            return SolveResult.failed(SolveErrorKind.TIMEOUT,
                    "solve-field did not finish within " + deadline.toMillis() + " ms",
                    elapsedSeconds(startedAt), outcome.output());
        }
        if (outcome.status() == ProcessOutcome.Status.CANCELLED) {
            return SolveResult.failed(SolveErrorKind.TIMEOUT,
                    "solve cancelled before solve-field finished", elapsedSeconds(startedAt), outcome.output());
        }

        if (!Files.exists(wcsFile)) {
            final var solveTime = elapsedSeconds(startedAt);
            if (outcome.exitCode() != 0) {
                log.warn("[solve-field] Exited with status {} and no solution ({}s)",
                        outcome.exitCode(), String.format("%.2f", solveTime));
            } else {
                log.info("[solve-field] No solution found ({}s)", String.format("%.2f", solveTime));
            }
            return SolveResult.unsolved(solveTime, outcome.output());
        }

        try {
            final var solution = solutionExtractor.extract(wcsFile, stagedInput);
            final var solveTime = elapsedSeconds(startedAt);
            log.info("[solve-field] Solved — ra={}, dec={}, scale={} arcsec/px, time={}s",
                    String.format("%.6f", solution.ra()),
                    String.format("%.6f", solution.dec()),
                    String.format("%.2f", solution.pixelScale()),
                    String.format("%.2f", solveTime));
            return SolveResult.solved(solution, solveTime, outcome.output());
        } catch (final WcsParseException e) {
            log.error("[solve-field] Unreadable WCS sidecar {}: {}", wcsFile.getFileName(), e.getMessage());
            return SolveResult.failed(SolveErrorKind.PARSE_FAILURE, e.getMessage(),
                    elapsedSeconds(startedAt), outcome.output());
        }
    }

    private List<String> arguments(final Path stagedInput, final SolveOptions options) throws IOException {
        final var config = SolverOutputs.sibling(stagedInput, SolverOutputs.CONFIG);
        Files.writeString(config, "add_path " + indexPath + "\nautoindex\ninparallel\n");

        final var args = new ArrayList<String>();
        args.add("--overwrite");
        args.add("--no-plots");
        args.add("--dir");
        args.add(stagedInput.getParent().toString());
        args.add("--config");
        args.add(config.toString());
        args.addAll(SolveFieldArguments.translate(options));
        args.add(stagedInput.toString());
        return args;
    }

    private Duration effectiveDeadline(final Duration requested) {
        if (requested != null && (requested.isNegative() || requested.isZero())) {
            throw new IllegalArgumentException("deadline must be positive, got " + requested);
        }
        var deadline = configuredTimeout.compareTo(MAX_DEADLINE) < 0 ? configuredTimeout : MAX_DEADLINE;
        if (requested != null && requested.compareTo(deadline) < 0) {
            deadline = requested;
        }
        return deadline;
    }

    private static double elapsedSeconds(final long startedAt) {
        return (System.nanoTime() - startedAt) / NANOS_PER_SECOND;
    }
}
