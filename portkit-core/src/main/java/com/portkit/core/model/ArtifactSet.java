package com.portkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generated outputs for one processing unit.
 *
 * @param artifacts generated files, at most one per role
 */
public record ArtifactSet(
    @JsonProperty("artifacts") List<Artifact> artifacts
) {
    /**
     * Compact constructor with validation.
     */
    public ArtifactSet {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        Set<ArtifactRole> seen = EnumSet.noneOf(ArtifactRole.class);
        for (Artifact artifact : artifacts) {
            if (!seen.add(artifact.role())) {
                throw new IllegalArgumentException("Duplicate artifact role: " + artifact.role());
            }
        }
    }

    /**
     * @return an artifact set without artifacts
     */
    public static ArtifactSet empty() {
        return new ArtifactSet(List.of());
    }

    /**
     * Finds the artifact for a role.
     *
     * @param role artifact role
     * @return artifact, or empty if absent
     */
    public Optional<Artifact> find(ArtifactRole role) {
        return artifacts.stream().filter(a -> a.role() == role).findFirst();
    }

    /**
     * @return roles present in this set
     */
    public Set<ArtifactRole> roles() {
        Set<ArtifactRole> roles = EnumSet.noneOf(ArtifactRole.class);
        artifacts.forEach(a -> roles.add(a.role()));
        return roles;
    }

    /**
     * Returns the required roles missing from this set.
     *
     * @param required roles the set must contain
     * @return missing roles, in declaration order
     */
    public List<ArtifactRole> missing(Collection<ArtifactRole> required) {
        Set<ArtifactRole> present = roles();
        return required.stream()
            .filter(role -> !present.contains(role))
            .sorted()
            .toList();
    }
}
