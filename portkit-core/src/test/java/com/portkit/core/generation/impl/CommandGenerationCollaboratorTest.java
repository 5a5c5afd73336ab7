package com.portkit.core.generation.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portkit.core.facts.SymbolFact;
import com.portkit.core.generation.GenerationException;
import com.portkit.core.generation.GenerationFeedback;
import com.portkit.core.generation.GenerationRequest;
import com.portkit.core.generation.GenerationResponse;
import com.portkit.core.graph.SymbolGraph;
import com.portkit.core.model.Artifact;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ErrorKind;
import com.portkit.core.model.ErrorSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CommandGenerationCollaborator}.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandGenerationCollaboratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    @TempDir
    Path tempDir;

    private GenerationRequest request;

    @BeforeEach
    void setUp() {
        SymbolGraph graph = SymbolGraph.build(List.of(
            SymbolFact.of("helper", "function"),
            SymbolFact.of("crc32", "function", "helper", "size_t")), List.of("size_t"));
        ArtifactSet helperArtifacts = new ArtifactSet(List.of(
            new Artifact(ArtifactRole.IMPLEMENTATION, "src/helper.rs", "pub fn helper() {}")));
        GenerationFeedback feedback = new GenerationFeedback(1,
            List.of(new ErrorSummary(ErrorKind.COMPILE_FAILURE, "[compile] error[E0308]")), false);
        request = new GenerationRequest(graph.unit("crc32").orElseThrow(), 2,
            EnumSet.of(ArtifactRole.BINDINGS, ArtifactRole.IMPLEMENTATION),
            Map.of("helper", helperArtifacts), feedback);
    }

    @Test
    void generate_okResponse_returnsArtifacts() throws GenerationException {
        CommandGenerationCollaborator collaborator = collaborator("""
            cat > /dev/null
            echo '{"status":"ok","artifacts":[
              {"role":"bindings","path":"src/ffi.rs","content":"extern {}"},
              {"role":"implementation","path":"src/crc32.rs","content":"pub fn crc32() {}"}]}'
            """);

        GenerationResponse response = collaborator.generate(request);

        assertThat(response.accepted()).isTrue();
        assertThat(response.artifacts().roles()).containsExactlyInAnyOrder(ArtifactRole.BINDINGS, ArtifactRole.IMPLEMENTATION);
        assertThat(response.artifacts().find(ArtifactRole.IMPLEMENTATION).orElseThrow().relativePath())
            .isEqualTo("src/crc32.rs");
    }

    @Test
    void generate_writesRequestToStdin() throws IOException, GenerationException {
        Path captured = tempDir.resolve("request.json");
        CommandGenerationCollaborator collaborator = collaborator(
            "cat > " + captured + "\necho '{\"status\":\"refused\",\"reason\":\"n/a\"}'");

        collaborator.generate(request);

        JsonNode sent = new ObjectMapper().readTree(Files.readString(captured));
        assertThat(sent.path("unit").asText()).isEqualTo("crc32");
        assertThat(sent.path("attempt").asInt()).isEqualTo(2);
        List<String> required = new ArrayList<>();
        sent.path("requiredArtifacts").forEach(role -> required.add(role.asText()));
        assertThat(required).containsExactly("bindings", "implementation");
        assertThat(sent.path("symbols").get(0).path("name").asText()).isEqualTo("crc32");
        assertThat(sent.path("externalDependencies").get(0).asText()).isEqualTo("size_t");
        assertThat(sent.path("dependencies").path("helper").get(0).path("path").asText()).isEqualTo("src/helper.rs");
        assertThat(sent.path("feedback").asText()).startsWith("Attempt 1 is not yet complete.");
    }

    @Test
    void generate_refusedResponse_returnsRefusal() throws GenerationException {
        CommandGenerationCollaborator collaborator = collaborator(
            "cat > /dev/null; echo '{\"status\":\"refused\",\"reason\":\"inline assembly\"}'");

        GenerationResponse response = collaborator.generate(request);

        assertThat(response.accepted()).isFalse();
        assertThat(response.reason()).isEqualTo("inline assembly");
        assertThat(response.artifacts().artifacts()).isEmpty();
    }

    @Test
    void generate_nonZeroExit_throwsWithStderr() {
        CommandGenerationCollaborator collaborator = collaborator("cat > /dev/null; echo 'rate limited' 1>&2; exit 4");

        assertThatThrownBy(() -> collaborator.generate(request))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("exited with code 4")
            .hasMessageContaining("rate limited");
    }

    @Test
    void generate_invalidJson_throws() {
        CommandGenerationCollaborator collaborator = collaborator("cat > /dev/null; echo 'not json'");

        assertThatThrownBy(() -> collaborator.generate(request))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("invalid JSON")
            .hasMessageContaining("Unrecognized token 'not'")
            .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void generate_unknownRole_throws() {
        CommandGenerationCollaborator collaborator = collaborator(
            "cat > /dev/null; echo '{\"status\":\"ok\",\"artifacts\":[{\"role\":\"docs\",\"path\":\"a\",\"content\":\"b\"}]}'");

        assertThatThrownBy(() -> collaborator.generate(request))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("Unknown artifact role 'docs'");
    }

    @Test
    void generate_duplicateRole_throws() {
        CommandGenerationCollaborator collaborator = collaborator("""
            cat > /dev/null
            echo '{"status":"ok","artifacts":[
              {"role":"implementation","path":"a.rs","content":"1"},
              {"role":"implementation","path":"b.rs","content":"2"}]}'
            """);

        assertThatThrownBy(() -> collaborator.generate(request))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("Duplicate artifact role");
    }

    @Test
    void generate_timeout_throws() {
        CommandGenerationCollaborator collaborator = new CommandGenerationCollaborator(
            List.of("sh", "-c", "exec sleep 30"), tempDir, Duration.ofMillis(300));

        assertThatThrownBy(() -> collaborator.generate(request))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("timed out");
    }

    @Test
    void constructor_emptyCommand_throws() {
        assertThatThrownBy(() -> new CommandGenerationCollaborator(List.of(), tempDir, TIMEOUT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("generation.command must be set");
    }

    private CommandGenerationCollaborator collaborator(String script) {
        return new CommandGenerationCollaborator(List.of("sh", "-c", script), tempDir, TIMEOUT);
    }
}
