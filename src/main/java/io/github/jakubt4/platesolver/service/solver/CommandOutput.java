package io.github.jakubt4.platesolver.service.solver;

/**
 * Result of a short-lived tool invocation such as {@code solve-field --version}.
 *
 * @param exitCode process exit status
 * @param output   combined stdout/stderr, surrounding whitespace removed
 */
public record CommandOutput(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
