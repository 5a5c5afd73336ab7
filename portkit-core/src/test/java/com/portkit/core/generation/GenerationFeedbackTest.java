package com.portkit.core.generation;

import com.portkit.core.facts.SymbolFact;
import com.portkit.core.graph.SymbolGraph;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ErrorKind;
import com.portkit.core.model.ErrorSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerationFeedback} and {@link ArtifactRequirements}.
 */
class GenerationFeedbackTest {

    @Test
    void format_listsIssuesInOrder() {
        GenerationFeedback feedback = new GenerationFeedback(3, List.of(
            new ErrorSummary(ErrorKind.COMPILE_FAILURE, "[compile] error[E0308]: mismatched types"),
            new ErrorSummary(ErrorKind.BEHAVIORAL_MISMATCH, "[test] output differs")), false);

        assertThat(feedback.format()).isEqualTo("""
            Attempt 3 is not yet complete. The following issues were encountered:
            - COMPILE_FAILURE: [compile] error[E0308]: mismatched types
            - BEHAVIORAL_MISMATCH: [test] output differs""");
    }

    @Test
    void format_unchangedArtifacts_addsHint() {
        GenerationFeedback feedback = new GenerationFeedback(2,
            List.of(new ErrorSummary(ErrorKind.COMPILE_FAILURE, "x")), true);

        assertThat(feedback.format()).contains("identical to the previous attempt");
    }

    @Test
    void forUnit_function_requiresDifferentialTest() {
        SymbolGraph graph = SymbolGraph.build(List.of(
            SymbolFact.of("Point", "struct"),
            SymbolFact.of("norm", "function", "Point")), List.of());

        assertThat(ArtifactRequirements.forUnit(graph.unit("norm").orElseThrow(), false))
            .containsExactly(ArtifactRole.BINDINGS, ArtifactRole.IMPLEMENTATION, ArtifactRole.DIFFERENTIAL_TEST);
        assertThat(ArtifactRequirements.forUnit(graph.unit("Point").orElseThrow(), false))
            .containsExactly(ArtifactRole.BINDINGS, ArtifactRole.IMPLEMENTATION);
        assertThat(ArtifactRequirements.forUnit(graph.unit("Point").orElseThrow(), true))
            .contains(ArtifactRole.DIFFERENTIAL_TEST);
    }
}
