package com.portkit.core.task;

import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ErrorSummary;
import com.portkit.core.model.PortingStatus;

import java.util.Objects;

/**
 * What a porting task ended with.
 *
 * @param unitId processing unit id
 * @param status last persisted status ({@code VERIFIED} or {@code FAILED} unless interrupted)
 * @param attempts attempt count at the end
 * @param artifacts verified artifact set; empty unless verified
 * @param lastError last error, or null
 * @param interrupted true if the task stopped on cancellation before reaching a terminal state
 */
public record TaskResult(
    String unitId,
    PortingStatus status,
    int attempts,
    ArtifactSet artifacts,
    ErrorSummary lastError,
    boolean interrupted
) {
    /**
     * Compact constructor with validation.
     */
    public TaskResult {
        Objects.requireNonNull(unitId, "unitId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (artifacts == null) {
            artifacts = ArtifactSet.empty();
        }
    }

    public boolean verified() {
        return !interrupted && status == PortingStatus.VERIFIED;
    }

    public boolean failed() {
        return !interrupted && status == PortingStatus.FAILED;
    }
}
