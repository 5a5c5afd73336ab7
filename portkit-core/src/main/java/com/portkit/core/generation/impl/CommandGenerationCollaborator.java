package com.portkit.core.generation.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.portkit.core.generation.GenerationCollaborator;
import com.portkit.core.generation.GenerationException;
import com.portkit.core.generation.GenerationRequest;
import com.portkit.core.generation.GenerationResponse;
import com.portkit.core.model.Artifact;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.Symbol;
import com.portkit.core.process.CommandResult;
import com.portkit.core.process.ProcessExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collaborator that runs an external command per request, speaking JSON over stdin/stdout.
 *
 * <p><b>Request</b> (written to stdin):
 * <pre>{@code
 * {
 *   "unit": "cycle-NodeA",
 *   "attempt": 2,
 *   "requiredArtifacts": ["bindings", "implementation", "differential-test"],
 *   "symbols": [{"name": "NodeA", "kind": "struct", "file": "src/node.h", "line": 3,
 *                "static": false, "definition": "struct NodeA {...}", "dependencies": ["NodeB"]}],
 *   "externalDependencies": ["size_t"],
 *   "dependencies": {"Helper": [{"role": "implementation", "path": "src/helper.rs", "content": "..."}]},
 *   "feedback": "Attempt 1 is not yet complete. ..."
 * }
 * }</pre>
 *
 * <p><b>Response</b> (read from stdout):
 * <pre>{@code
 * {"status": "ok", "artifacts": [{"role": "implementation", "path": "src/node.rs", "content": "..."}]}
 * {"status": "refused", "reason": "definition uses inline assembly"}
 * }</pre>
 *
 * <p>A non-zero exit, a timeout or unparsable output raises {@link GenerationException};
 * stderr is included in the message.
 */
public class CommandGenerationCollaborator implements GenerationCollaborator {

    private static final Logger log = LoggerFactory.getLogger(CommandGenerationCollaborator.class);
    private static final int MAX_STDERR_IN_MESSAGE = 2_000;

    private final List<String> command;
    private final Path workingDirectory;
    private final Duration timeout;
    private final ProcessExecutor executor;
    private final ObjectMapper mapper = new ObjectMapper();

    public CommandGenerationCollaborator(List<String> command, Path workingDirectory, Duration timeout) {
        this(command, workingDirectory, timeout, new ProcessExecutor());
    }

    public CommandGenerationCollaborator(List<String> command,
                                         Path workingDirectory,
                                         Duration timeout,
                                         ProcessExecutor executor) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("generation.command must be set for the command backend");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) throws GenerationException {
        String unitId = request.unit().id();
        String payload;
        try {
            payload = mapper.writeValueAsString(toJson(request));
        } catch (IOException e) {
            throw new GenerationException("Failed to serialize generation request for " + unitId, e);
        }

        log.debug("Requesting generation of {} (attempt {})", unitId, request.attempt());
        CommandResult result;
        try {
            result = executor.execute(command, workingDirectory, timeout, payload, false);
        } catch (IOException e) {
            throw new GenerationException("Failed to run generation command: " + e.getMessage(), e);
        }

        if (result.timedOut()) {
            throw new GenerationException("Generation command timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            throw new GenerationException("Generation command exited with code " + result.exitCode()
                + stderrSuffix(result.stderr()));
        }
        return parseResponse(result.stdout(), result.stderr());
    }

    private ObjectNode toJson(GenerationRequest request) {
        ObjectNode root = mapper.createObjectNode();
        root.put("unit", request.unit().id());
        root.put("attempt", request.attempt());

        ArrayNode required = root.putArray("requiredArtifacts");
        request.requiredRoles().stream().sorted().forEach(role -> required.add(role.label()));

        ArrayNode symbols = root.putArray("symbols");
        for (Symbol symbol : request.unit().members()) {
            ObjectNode node = symbols.addObject();
            node.put("name", symbol.name());
            node.put("kind", symbol.kind().label());
            node.put("file", symbol.location().file());
            node.put("line", symbol.location().line());
            node.put("static", symbol.isStatic());
            node.put("definition", symbol.definition());
            ArrayNode dependencies = node.putArray("dependencies");
            symbol.dependencies().forEach(dependencies::add);
        }

        ArrayNode external = root.putArray("externalDependencies");
        request.unit().externalDependencies().forEach(external::add);

        ObjectNode dependencies = root.putObject("dependencies");
        for (String dependencyId : request.unit().dependencyUnitIds()) {
            ArtifactSet artifacts = request.dependencyArtifacts().getOrDefault(dependencyId, ArtifactSet.empty());
            ArrayNode list = dependencies.putArray(dependencyId);
            for (Artifact artifact : artifacts.artifacts()) {
                list.addObject()
                    .put("role", artifact.role().label())
                    .put("path", artifact.relativePath())
                    .put("content", artifact.content());
            }
        }

        if (request.feedback() != null) {
            root.put("feedback", request.feedback().format());
        } else {
            root.putNull("feedback");
        }
        return root;
    }

    private GenerationResponse parseResponse(String stdout, String stderr) throws GenerationException {
        JsonNode root;
        try {
            root = mapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Generation command returned invalid JSON: " + e.getOriginalMessage()
                + stderrSuffix(stderr), e);
        }
        if (root == null || !root.isObject()) {
            throw new GenerationException("Generation command returned no JSON object" + stderrSuffix(stderr));
        }

        String status = root.path("status").asText("");
        return switch (status) {
            case "ok" -> GenerationResponse.ok(parseArtifacts(root.path("artifacts")));
            case "refused" -> GenerationResponse.refused(root.path("reason").asText("no reason given"));
            default -> throw new GenerationException("Unknown response status '" + status + "'");
        };
    }

    private ArtifactSet parseArtifacts(JsonNode node) throws GenerationException {
        if (!node.isArray()) {
            throw new GenerationException("Response field 'artifacts' must be an array");
        }
        List<Artifact> artifacts = new ArrayList<>();
        for (JsonNode item : node) {
            String label = item.path("role").asText("");
            ArtifactRole role = ArtifactRole.fromLabel(label)
                .orElseThrow(() -> new GenerationException("Unknown artifact role '" + label + "'"));
            String path = item.path("path").asText("");
            if (path.isBlank() || !item.hasNonNull("content")) {
                throw new GenerationException("Artifact '" + label + "' needs a path and content");
            }
            artifacts.add(new Artifact(role, path, item.get("content").asText()));
        }
        try {
            return new ArtifactSet(artifacts);
        } catch (IllegalArgumentException e) {
            throw new GenerationException(e.getMessage(), e);
        }
    }

    private static String stderrSuffix(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "";
        }
        String trimmed = stderr.strip();
        if (trimmed.length() > MAX_STDERR_IN_MESSAGE) {
            trimmed = trimmed.substring(trimmed.length() - MAX_STDERR_IN_MESSAGE);
        }
        return "\n" + trimmed;
    }

    /**
     * @return configured command line, for diagnostics
     */
    public List<String> command() {
        return command;
    }
}
