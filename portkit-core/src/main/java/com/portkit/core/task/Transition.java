package com.portkit.core.task;

/**
 * Next step of a porting task after a verdict or a failed generation.
 */
public enum Transition {
    /** Validation passed: the unit is verified */
    ADVANCE,

    /** Generate again, carrying the diagnostics forward */
    RETRY_WITH_FEEDBACK,

    /** Validate the same artifacts again after a backoff */
    REVALIDATE,

    /** Stop: the unit has failed */
    FAIL
}
