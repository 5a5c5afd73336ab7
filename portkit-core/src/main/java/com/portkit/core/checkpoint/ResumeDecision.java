package com.portkit.core.checkpoint;

import com.portkit.core.model.CheckpointRecord;

import java.util.Optional;

/**
 * What a new run does with a unit, given its checkpoint record.
 */
public enum ResumeDecision {
    /** No record, or reset to unstarted: start from the recorded attempt count */
    FRESH,

    /** Verified in an earlier run: skip */
    SKIP_VERIFIED,

    /** Failed with attempts left: continue at the next attempt */
    RETRY_FAILED,

    /** Interrupted while generating or validating: redo that attempt */
    RESTART_IN_FLIGHT,

    /** Failed with no attempts left: stays failed */
    EXHAUSTED;

    /**
     * Derives the decision for a unit.
     *
     * @param record stored record, if any
     * @param maxAttempts generation attempts allowed per unit
     * @return resume decision
     */
    public static ResumeDecision of(Optional<CheckpointRecord> record, int maxAttempts) {
        if (record.isEmpty()) {
            return FRESH;
        }
        CheckpointRecord stored = record.get();
        return switch (stored.status()) {
            case UNSTARTED -> FRESH;
            case VERIFIED -> SKIP_VERIFIED;
            case GENERATING, VALIDATING -> RESTART_IN_FLIGHT;
            case FAILED -> stored.attemptCount() < maxAttempts ? RETRY_FAILED : EXHAUSTED;
        };
    }

    /**
     * @return true unless the unit is permanently failed
     */
    public boolean isResumable() {
        return this != EXHAUSTED;
    }
}
