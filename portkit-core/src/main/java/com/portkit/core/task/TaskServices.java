package com.portkit.core.task;

import com.portkit.core.artifact.ArtifactWorkspace;
import com.portkit.core.generation.GenerationCollaborator;
import com.portkit.core.validation.ValidationRunner;

import java.util.Objects;

/**
 * Collaborators shared by every porting task of a run.
 *
 * @param collaborator code generation collaborator
 * @param validationRunner validation runner
 * @param workspace artifact workspace
 * @param retryPolicy retry policy
 * @param requireTestForDataTypes require a differential test for units without functions
 */
public record TaskServices(
    GenerationCollaborator collaborator,
    ValidationRunner validationRunner,
    ArtifactWorkspace workspace,
    RetryPolicy retryPolicy,
    boolean requireTestForDataTypes
) {
    /**
     * Compact constructor with validation.
     */
    public TaskServices {
        Objects.requireNonNull(collaborator, "collaborator must not be null");
        Objects.requireNonNull(validationRunner, "validationRunner must not be null");
        Objects.requireNonNull(workspace, "workspace must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }
}
