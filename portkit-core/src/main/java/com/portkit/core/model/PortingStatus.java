package com.portkit.core.model;

/**
 * Persisted lifecycle status of a processing unit.
 *
 * <p>{@code UNSTARTED -> GENERATING -> VALIDATING -> (VERIFIED | FAILED)}, with
 * {@code VALIDATING} looping back to {@code GENERATING} while retries remain.
 */
public enum PortingStatus {
    UNSTARTED,
    GENERATING,
    VALIDATING,
    VERIFIED,
    FAILED;

    /**
     * @return true for {@link #VERIFIED} and {@link #FAILED}
     */
    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED;
    }

    /**
     * @return true if a unit in this status was interrupted mid-attempt
     */
    public boolean isInFlight() {
        return this == GENERATING || this == VALIDATING;
    }

    /**
     * Returns whether the state machine allows moving from this status to {@code next}.
     *
     * @param next target status
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(PortingStatus next) {
        return switch (this) {
            case UNSTARTED -> next == GENERATING;
            case GENERATING -> next == GENERATING || next == VALIDATING || next == FAILED;
            case VALIDATING -> next == GENERATING || next == VERIFIED || next == FAILED;
            case VERIFIED, FAILED -> false;
        };
    }
}
