package com.portkit.core.generation;

/**
 * The external code generator, seen through one narrow operation.
 *
 * <p>Implementations may block for a long time. They are called from worker
 * threads and must be safe to call concurrently for different units.
 */
@FunctionalInterface
public interface GenerationCollaborator {

    /**
     * Generates the artifact set for one unit.
     *
     * @param request unit, context and feedback
     * @return artifacts, or a refusal
     * @throws GenerationException if the backend failed or answered with something unusable
     */
    GenerationResponse generate(GenerationRequest request) throws GenerationException;
}
