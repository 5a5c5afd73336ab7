package com.portkit.core.generation;

import com.portkit.core.model.ErrorSummary;

import java.util.List;

/**
 * Diagnostics from a previous attempt, handed to the collaborator on retry.
 *
 * @param previousAttempt attempt number the diagnostics come from
 * @param issues errors of that attempt, in the order they occurred
 * @param unchangedArtifacts true if that attempt repeated the artifacts of the attempt before it
 */
public record GenerationFeedback(
    int previousAttempt,
    List<ErrorSummary> issues,
    boolean unchangedArtifacts
) {
    /**
     * Compact constructor with defaults.
     */
    public GenerationFeedback {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Renders the feedback as text for a prompt.
     *
     * @return feedback message
     */
    public String format() {
        StringBuilder text = new StringBuilder("Attempt ")
            .append(previousAttempt)
            .append(" is not yet complete. The following issues were encountered:");
        for (ErrorSummary issue : issues) {
            text.append("\n- ").append(issue.kind()).append(": ").append(issue.message());
        }
        if (unchangedArtifacts) {
            text.append("\n- The generated artifacts were identical to the previous attempt; a different approach is needed.");
        }
        return text.toString();
    }
}
