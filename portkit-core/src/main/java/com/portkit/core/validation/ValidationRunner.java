package com.portkit.core.validation;

import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.Verdict;

/**
 * Validates a unit's artifact set against the original code.
 *
 * <p>Steps run in order and stop at the first failure:
 * <ol>
 *   <li>compile the artifact set in isolation</li>
 *   <li>compile it linked against the rest of the project, when the unit's dependents need it</li>
 *   <li>run the differential test</li>
 * </ol>
 *
 * <p>Implementations report toolchain problems (timeouts, missing executables)
 * as {@link com.portkit.core.model.VerdictType#RUNNER_ERROR} and must not throw
 * for them. The artifacts are already written to the artifact workspace when
 * {@link #validate} is called.
 */
public interface ValidationRunner {

    /**
     * Validates an artifact set.
     *
     * @param unit processing unit the artifacts belong to
     * @param artifacts artifact set to validate
     * @return verdict of the first failing step, or {@link Verdict#pass()}
     */
    Verdict validate(ProcessingUnit unit, ArtifactSet artifacts);
}
