package com.portkit.core.model;

/**
 * Classification of a unit-level failure.
 */
public enum ErrorKind {
    /** Collaborator refused, failed, or returned an incomplete artifact set */
    GENERATION_INCOMPLETE,

    /** Artifacts did not compile, alone or linked with the project */
    COMPILE_FAILURE,

    /** Differential test found diverging behavior */
    BEHAVIORAL_MISMATCH,

    /** Toolchain missing, timed out, or otherwise unusable */
    RUNNER_ERROR,

    /** A dependency unit failed terminally */
    CHAIN_BLOCKED;

    /**
     * Returns whether the error is a defect in generated code, as opposed to
     * an infrastructure or scheduling problem.
     *
     * @return true for compile failures and behavioral mismatches
     */
    public boolean isDefect() {
        return this == COMPILE_FAILURE || this == BEHAVIORAL_MISMATCH;
    }
}
