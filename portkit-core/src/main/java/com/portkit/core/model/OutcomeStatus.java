package com.portkit.core.model;

/**
 * Final status of a unit in a run summary.
 */
public enum OutcomeStatus {
    /** Artifacts passed validation */
    VERIFIED,

    /** Retry budget exhausted, or infrastructure kept failing */
    FAILED,

    /** A dependency failed; never dispatched. Derived, not persisted */
    BLOCKED,

    /** Not reached before the run stopped */
    PENDING
}
