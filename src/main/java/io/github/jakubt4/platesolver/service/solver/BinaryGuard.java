package io.github.jakubt4.platesolver.service.solver;

/**
 * Allowlist check for executable names that arrive as free-form strings.
 *
 * <p>Matching is exact: no trimming, case folding, prefix or pattern rules. A name
 * such as {@code "solve-field; rm -rf /"} or {@code "../solve-field"} is rejected.
 * The check has no side effects and never starts a process.
 */
public final class BinaryGuard {

    private BinaryGuard() {
    }

    /**
     * Resolves {@code name} to its allowlisted binary.
     *
     * @param name executable name exactly as installed, e.g. {@code "solve-field"}
     * @return the matching binary
     * @throws InvalidBinaryException if the name is not on the allowlist
     */
    public static AstrometryBinary authorize(final String name) {
        return AstrometryBinary.byExecutable(name)
                .orElseThrow(() -> new InvalidBinaryException(name));
    }
}
