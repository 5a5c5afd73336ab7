package com.portkit.core.generation;

import com.portkit.core.model.ArtifactSet;

import java.util.Objects;

/**
 * Collaborator answer: an artifact set, or an explicit refusal.
 *
 * @param status response status
 * @param artifacts generated artifacts; empty when refused
 * @param reason refusal reason; null when accepted
 */
public record GenerationResponse(
    Status status,
    ArtifactSet artifacts,
    String reason
) {
    /**
     * Response status.
     */
    public enum Status {
        /** Artifacts were produced */
        OK,
        /** The collaborator declined to produce artifacts */
        REFUSED
    }

    /**
     * Compact constructor with validation.
     */
    public GenerationResponse {
        Objects.requireNonNull(status, "status must not be null");
        if (artifacts == null) {
            artifacts = ArtifactSet.empty();
        }
    }

    public static GenerationResponse ok(ArtifactSet artifacts) {
        return new GenerationResponse(Status.OK, artifacts, null);
    }

    public static GenerationResponse refused(String reason) {
        return new GenerationResponse(Status.REFUSED, ArtifactSet.empty(), reason);
    }

    public boolean accepted() {
        return status == Status.OK;
    }
}
