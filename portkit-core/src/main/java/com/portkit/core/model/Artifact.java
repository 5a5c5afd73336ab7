package com.portkit.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One generated file.
 *
 * @param role role in the artifact set
 * @param relativePath path relative to the unit's artifact directory
 * @param content file content
 */
public record Artifact(
    @JsonProperty("role") ArtifactRole role,
    @JsonProperty("relativePath") String relativePath,
    @JsonProperty("content") String content
) {
    /**
     * Compact constructor with validation.
     */
    public Artifact {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
