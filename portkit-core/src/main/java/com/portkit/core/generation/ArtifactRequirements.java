package com.portkit.core.generation;

import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ProcessingUnit;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides which artifact roles a unit's artifact set must contain.
 *
 * <p>Bindings and implementation are always required. A differential test is
 * required for units with at least one function; plain data types only need it
 * when configured.
 */
public final class ArtifactRequirements {

    private ArtifactRequirements() {
        // Utility class
    }

    /**
     * @param unit processing unit
     * @param requireTestForDataTypes require a differential test for units without functions
     * @return required roles
     */
    public static Set<ArtifactRole> forUnit(ProcessingUnit unit, boolean requireTestForDataTypes) {
        Set<ArtifactRole> roles = EnumSet.of(ArtifactRole.BINDINGS, ArtifactRole.IMPLEMENTATION);
        if (unit.hasBehavior() || requireTestForDataTypes) {
            roles.add(ArtifactRole.DIFFERENTIAL_TEST);
        }
        return roles;
    }
}
