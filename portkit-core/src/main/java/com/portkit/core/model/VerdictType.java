package com.portkit.core.model;

/**
 * Outcome classes of a validation run.
 */
public enum VerdictType {
    PASS,
    COMPILE_FAILURE,
    BEHAVIORAL_MISMATCH,
    RUNNER_ERROR
}
