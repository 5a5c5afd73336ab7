package com.portkit.core.model;

import java.util.Objects;

/**
 * Result of validating one artifact set.
 *
 * <p>{@link VerdictType#RUNNER_ERROR} means the toolchain could not produce an
 * answer; it never indicates a defect in the generated code.
 *
 * @param type verdict class
 * @param step validation step that produced the verdict ({@code compile}, {@code link}, {@code test})
 * @param detail diagnostics, diff summary, or failure cause; empty for a pass
 */
public record Verdict(
    VerdictType type,
    String step,
    String detail
) {
    /**
     * Compact constructor with validation.
     */
    public Verdict {
        Objects.requireNonNull(type, "type must not be null");
        if (step == null) {
            step = "";
        }
        if (detail == null) {
            detail = "";
        }
    }

    public static Verdict pass() {
        return new Verdict(VerdictType.PASS, "", "");
    }

    public static Verdict compileFailure(String step, String diagnostics) {
        return new Verdict(VerdictType.COMPILE_FAILURE, step, diagnostics);
    }

    public static Verdict behavioralMismatch(String step, String diffSummary) {
        return new Verdict(VerdictType.BEHAVIORAL_MISMATCH, step, diffSummary);
    }

    public static Verdict runnerError(String step, String cause) {
        return new Verdict(VerdictType.RUNNER_ERROR, step, cause);
    }

    /**
     * @return true if the artifacts passed every step
     */
    public boolean passed() {
        return type == VerdictType.PASS;
    }

    /**
     * Converts a failing verdict into the error summary persisted in checkpoints.
     *
     * @return error summary
     * @throws IllegalStateException if the verdict is a pass
     */
    public ErrorSummary toErrorSummary() {
        ErrorKind kind = switch (type) {
            case PASS -> throw new IllegalStateException("A passing verdict has no error");
            case COMPILE_FAILURE -> ErrorKind.COMPILE_FAILURE;
            case BEHAVIORAL_MISMATCH -> ErrorKind.BEHAVIORAL_MISMATCH;
            case RUNNER_ERROR -> ErrorKind.RUNNER_ERROR;
        };
        String prefix = step.isEmpty() ? "" : "[" + step + "] ";
        return new ErrorSummary(kind, prefix + detail);
    }
}
