package com.portkit.core.task;

import com.portkit.core.checkpoint.ResumeDecision;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.CheckpointRecord;
import com.portkit.core.model.ErrorSummary;

import java.util.Map;

/**
 * Where a porting task starts.
 *
 * @param completedAttempts attempts already used; the task starts at {@code completedAttempts + 1}
 * @param carriedError error to feed back on the first attempt, or null
 * @param previousFingerprints fingerprints of the last artifact set, for repeat detection
 */
public record ResumePoint(
    int completedAttempts,
    ErrorSummary carriedError,
    Map<ArtifactRole, String> previousFingerprints
) {
    /**
     * Compact constructor with defaults.
     */
    public ResumePoint {
        if (completedAttempts < 0) {
            completedAttempts = 0;
        }
        previousFingerprints = previousFingerprints == null ? Map.of() : Map.copyOf(previousFingerprints);
    }

    public static ResumePoint fresh() {
        return new ResumePoint(0, null, Map.of());
    }

    /**
     * Derives the start point from a stored record.
     *
     * <p>Failed units continue after their recorded attempts. Units interrupted
     * while generating or validating redo the recorded attempt, which never
     * reached a verdict. Unstarted records keep their attempt count.
     *
     * @param decision resume decision for the record
     * @param record stored checkpoint record
     * @return start point
     * @throws IllegalArgumentException for decisions that do not start a task
     */
    public static ResumePoint from(ResumeDecision decision, CheckpointRecord record) {
        return switch (decision) {
            case FRESH -> new ResumePoint(record.attemptCount(), null, Map.of());
            case RETRY_FAILED -> new ResumePoint(record.attemptCount(), record.lastError(), record.fingerprints());
            case RESTART_IN_FLIGHT ->
                new ResumePoint(record.attemptCount() - 1, record.lastError(), Map.of());
            case SKIP_VERIFIED, EXHAUSTED ->
                throw new IllegalArgumentException("No task to resume for decision " + decision);
        };
    }
}
