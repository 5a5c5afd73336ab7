package com.portkit.core.checkpoint;

import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.CheckpointRecord;
import com.portkit.core.model.ErrorSummary;
import com.portkit.core.model.PortingStatus;
import com.portkit.core.model.ProcessingUnit;

import java.util.Map;
import java.util.Optional;

/**
 * Durable per-unit porting state; the only state that survives a restart.
 *
 * <p>Implementations must make {@link #record} an atomic upsert: after a crash
 * the store holds either the previous record or the new one, never a mix.
 * Implementations must be safe for concurrent use by several porting tasks.
 *
 * <p>Every method may throw {@link CheckpointStorageException}.
 */
public interface CheckpointStore {

    /**
     * Loads every stored record.
     *
     * @return records keyed by unit id; empty on first run
     */
    Map<String, CheckpointRecord> load();

    /**
     * Durably upserts the record of a unit.
     *
     * @param unit processing unit
     * @param status new status
     * @param attempt attempt count
     * @param fingerprints artifact fingerprints of the current attempt (may be empty)
     * @param error last error, or null
     * @return the stored record
     */
    CheckpointRecord record(ProcessingUnit unit,
                            PortingStatus status,
                            int attempt,
                            Map<ArtifactRole, String> fingerprints,
                            ErrorSummary error);

    /**
     * @param unitId processing unit id
     * @return stored record, if any
     */
    Optional<CheckpointRecord> find(String unitId);

    /**
     * Forces a unit back to {@link PortingStatus#UNSTARTED} with no attempts.
     *
     * @param unitId processing unit id
     * @return the rewritten record, or empty if the unit has no record
     */
    Optional<CheckpointRecord> reset(String unitId);

    /**
     * Decides how a new run treats the unit.
     *
     * @param unitId processing unit id
     * @param maxAttempts generation attempts allowed per unit
     * @return resume decision
     */
    default ResumeDecision resumeDecision(String unitId, int maxAttempts) {
        return ResumeDecision.of(find(unitId), maxAttempts);
    }

    /**
     * Returns whether the unit can still make progress: verified units are
     * skipped, failed units with attempts left are retried, anything else restarts.
     *
     * @param unitId processing unit id
     * @param maxAttempts generation attempts allowed per unit
     * @return false only for failed units with no attempts left
     */
    default boolean isResumable(String unitId, int maxAttempts) {
        return resumeDecision(unitId, maxAttempts).isResumable();
    }
}
