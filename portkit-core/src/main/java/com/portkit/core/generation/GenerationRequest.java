package com.portkit.core.generation;

import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ProcessingUnit;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a collaborator needs to generate one unit.
 *
 * @param unit unit to port; member symbols carry their source definitions
 * @param attempt attempt number, starting at 1
 * @param requiredRoles artifact roles the response must contain
 * @param dependencyArtifacts verified artifact sets of the units this unit depends on, by unit id
 * @param feedback diagnostics of the previous attempt, or null on a first attempt
 */
public record GenerationRequest(
    ProcessingUnit unit,
    int attempt,
    Set<ArtifactRole> requiredRoles,
    Map<String, ArtifactSet> dependencyArtifacts,
    GenerationFeedback feedback
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationRequest {
        Objects.requireNonNull(unit, "unit must not be null");
        requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
        dependencyArtifacts = dependencyArtifacts == null ? Map.of() : Map.copyOf(dependencyArtifacts);
    }

    public Optional<GenerationFeedback> feedbackIfAny() {
        return Optional.ofNullable(feedback);
    }
}
