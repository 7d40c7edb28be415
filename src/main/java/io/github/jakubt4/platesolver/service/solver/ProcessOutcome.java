package io.github.jakubt4.platesolver.service.solver;

/**
 * How a bounded process run ended.
 *
 * @param status   whether the process exited, hit its deadline, or was cancelled
 * @param exitCode exit status, {@code null} unless {@code status} is {@link Status#EXITED}
 * @param output   combined stdout/stderr captured up to the point the run ended
 */
public record ProcessOutcome(Status status, Integer exitCode, String output) {

    public enum Status { EXITED, TIMED_OUT, CANCELLED }

    static ProcessOutcome exited(final int exitCode, final String output) {
        return new ProcessOutcome(Status.EXITED, exitCode, output);
    }

    static ProcessOutcome timedOut(final String output) {
        return new ProcessOutcome(Status.TIMED_OUT, null, output);
    }

    static ProcessOutcome cancelled(final String output) {
        return new ProcessOutcome(Status.CANCELLED, null, output);
    }
}
