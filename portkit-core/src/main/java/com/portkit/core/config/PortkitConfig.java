package com.portkit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portkit.core.validation.LinkMode;

import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration for a porting project.
 *
 * <p>Loaded from {@code portkit.yaml}. Every section is optional; a missing
 * section or value takes the default shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "zopfli"
 *   directory: "."
 *
 * facts:
 *   path: "build/facts.json"
 *   external: [size_t, FILE, malloc, free]
 *
 * checkpoint:
 *   directory: ".portkit/checkpoints"
 *
 * artifacts:
 *   directory: ".portkit/artifacts"
 *
 * orchestrator:
 *   concurrency: 4
 *   shutdownGraceSeconds: 120
 *
 * retry:
 *   maxAttempts: 10
 *   infrastructureRetries: 3
 *   initialBackoffMillis: 1000
 *   maxBackoffMillis: 30000
 *
 * generation:
 *   backend: command
 *   command: ["python3", "tools/generate.py"]
 *   timeoutSeconds: 600
 *
 * validation:
 *   compileCommand: ["cargo", "build", "--manifest-path", "{unitDir}/Cargo.toml"]
 *   linkCommand: ["cargo", "build", "--manifest-path", "{projectDir}/Cargo.toml"]
 *   testCommand: ["cargo", "fuzz", "run", "{testTarget}", "--", "-max_total_time={timeout}"]
 *   linkMode: WHEN_DEPENDENTS
 *   timeoutSeconds: 60
 *   maxDiagnosticChars: 8000
 *
 * report:
 *   directory: ".portkit/reports"
 * }</pre>
 *
 * @param project project metadata
 * @param facts parsed-facts input
 * @param checkpoint checkpoint store settings
 * @param artifacts artifact workspace settings
 * @param orchestrator scheduling settings
 * @param retry retry budgets
 * @param generation generation collaborator settings
 * @param validation validation runner settings
 * @param report run report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortkitConfig(
    @JsonProperty("project") ProjectSettings project,
    @JsonProperty("facts") FactsSettings facts,
    @JsonProperty("checkpoint") CheckpointSettings checkpoint,
    @JsonProperty("artifacts") ArtifactSettings artifacts,
    @JsonProperty("orchestrator") OrchestratorSettings orchestrator,
    @JsonProperty("retry") RetrySettings retry,
    @JsonProperty("generation") GenerationSettings generation,
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("report") ReportSettings report
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public PortkitConfig {
        project = project == null ? new ProjectSettings(null, null) : project;
        facts = facts == null ? new FactsSettings(null, null) : facts;
        checkpoint = checkpoint == null ? new CheckpointSettings(null) : checkpoint;
        artifacts = artifacts == null ? new ArtifactSettings(null) : artifacts;
        orchestrator = orchestrator == null ? new OrchestratorSettings(null, null) : orchestrator;
        retry = retry == null ? new RetrySettings(null, null, null, null) : retry;
        generation = generation == null ? new GenerationSettings(null, null, null, null) : generation;
        validation = validation == null ? new ValidationSettings(null, null, null, null, null, null) : validation;
        report = report == null ? new ReportSettings(null) : report;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static PortkitConfig defaults() {
        return new PortkitConfig(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, used in reports
     * @param directory target project directory, relative to the configuration file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectSettings(
        @JsonProperty("name") String name,
        @JsonProperty("directory") String directory
    ) {
        public ProjectSettings {
            name = name == null ? "project" : name;
            directory = directory == null ? "." : directory;
        }
    }

    /**
     * Parsed-facts input.
     *
     * @param path facts document (JSON or YAML)
     * @param external additional external names, merged with the document's own list
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FactsSettings(
        @JsonProperty("path") String path,
        @JsonProperty("external") List<String> external
    ) {
        public FactsSettings {
            path = path == null ? "facts.json" : path;
            external = external == null ? List.of() : List.copyOf(external);
        }
    }

    /**
     * @param directory directory holding one JSON record per unit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckpointSettings(
        @JsonProperty("directory") String directory
    ) {
        public CheckpointSettings {
            directory = directory == null ? ".portkit/checkpoints" : directory;
        }
    }

    /**
     * @param directory root of the per-unit artifact directories
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArtifactSettings(
        @JsonProperty("directory") String directory
    ) {
        public ArtifactSettings {
            directory = directory == null ? ".portkit/artifacts" : directory;
        }
    }

    /**
     * Scheduling settings.
     *
     * @param concurrency maximum units in flight at once
     * @param shutdownGraceSeconds how long an interrupted run may take to reach its next checkpoint
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrchestratorSettings(
        @JsonProperty("concurrency") Integer concurrency,
        @JsonProperty("shutdownGraceSeconds") Integer shutdownGraceSeconds
    ) {
        public OrchestratorSettings {
            concurrency = concurrency == null || concurrency < 1 ? 1 : concurrency;
            shutdownGraceSeconds = shutdownGraceSeconds == null ? 120 : shutdownGraceSeconds;
        }
    }

    /**
     * Retry budgets.
     *
     * @param maxAttempts generation attempts per unit before it fails
     * @param infrastructureRetries re-validations of the same artifacts after a runner error
     * @param initialBackoffMillis wait before the first re-validation
     * @param maxBackoffMillis cap on the doubling backoff
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetrySettings(
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("infrastructureRetries") Integer infrastructureRetries,
        @JsonProperty("initialBackoffMillis") Long initialBackoffMillis,
        @JsonProperty("maxBackoffMillis") Long maxBackoffMillis
    ) {
        public RetrySettings {
            maxAttempts = maxAttempts == null || maxAttempts < 1 ? 10 : maxAttempts;
            infrastructureRetries = infrastructureRetries == null || infrastructureRetries < 0 ? 3 : infrastructureRetries;
            initialBackoffMillis = initialBackoffMillis == null || initialBackoffMillis < 0 ? 1_000L : initialBackoffMillis;
            maxBackoffMillis = maxBackoffMillis == null || maxBackoffMillis < initialBackoffMillis
                ? Math.max(30_000L, initialBackoffMillis)
                : maxBackoffMillis;
        }
    }

    /**
     * Generation collaborator settings.
     *
     * @param backend collaborator backend id, discovered via {@code ServiceLoader}
     * @param command backend command line (for the {@code command} backend)
     * @param timeoutSeconds maximum time for one generation request
     * @param requireDifferentialTestForDataTypes require a differential test for units without functions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationSettings(
        @JsonProperty("backend") String backend,
        @JsonProperty("command") List<String> command,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("requireDifferentialTestForDataTypes") Boolean requireDifferentialTestForDataTypes
    ) {
        public GenerationSettings {
            backend = backend == null ? "command" : backend;
            command = command == null ? List.of() : List.copyOf(command);
            timeoutSeconds = timeoutSeconds == null || timeoutSeconds < 1 ? 600 : timeoutSeconds;
            requireDifferentialTestForDataTypes = requireDifferentialTestForDataTypes != null
                && requireDifferentialTestForDataTypes;
        }
    }

    /**
     * Validation runner settings. Command templates may use {@code {unit}},
     * {@code {unitDir}}, {@code {projectDir}}, {@code {symbols}},
     * {@code {testTarget}} and {@code {timeout}}. An empty template skips the step.
     *
     * @param compileCommand isolated compile step
     * @param linkCommand compile step linked against the project
     * @param testCommand differential test step
     * @param linkMode when the link step runs
     * @param timeoutSeconds timeout per step
     * @param maxDiagnosticChars diagnostics longer than this keep only their tail
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("compileCommand") List<String> compileCommand,
        @JsonProperty("linkCommand") List<String> linkCommand,
        @JsonProperty("testCommand") List<String> testCommand,
        @JsonProperty("linkMode") LinkMode linkMode,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("maxDiagnosticChars") Integer maxDiagnosticChars
    ) {
        public ValidationSettings {
            compileCommand = compileCommand == null ? List.of() : List.copyOf(compileCommand);
            linkCommand = linkCommand == null ? List.of() : List.copyOf(linkCommand);
            testCommand = testCommand == null ? List.of() : List.copyOf(testCommand);
            linkMode = linkMode == null ? LinkMode.WHEN_DEPENDENTS : linkMode;
            timeoutSeconds = timeoutSeconds == null || timeoutSeconds < 1 ? 60 : timeoutSeconds;
            maxDiagnosticChars = maxDiagnosticChars == null || maxDiagnosticChars < 1 ? 8_000 : maxDiagnosticChars;
        }
    }

    /**
     * @param directory where run summaries are written
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportSettings(
        @JsonProperty("directory") String directory
    ) {
        public ReportSettings {
            directory = directory == null ? ".portkit/reports" : directory;
        }
    }

    /**
     * Resolves a configured path against a base directory, leaving absolute paths untouched.
     *
     * @param baseDir directory relative paths are resolved against
     * @param configured configured path
     * @return resolved, normalized path
     */
    public static Path resolve(Path baseDir, String configured) {
        Path path = Path.of(configured);
        return (path.isAbsolute() ? path : baseDir.resolve(path)).normalize();
    }
}
