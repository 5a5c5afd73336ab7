package com.portkit.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Role of a generated artifact within a unit's artifact set.
 */
public enum ArtifactRole {
    /** Interface-boundary bindings exposing the ported symbols to the original code */
    BINDINGS,

    /** Native implementation in the target language */
    IMPLEMENTATION,

    /** Test comparing original and ported behavior */
    DIFFERENTIAL_TEST;

    /**
     * Resolves a role from a protocol label such as {@code differential-test}.
     *
     * @param label role label
     * @return matching role, or empty if unknown
     */
    public static Optional<ArtifactRole> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ArtifactRole role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * @return lower-case, hyphenated label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
