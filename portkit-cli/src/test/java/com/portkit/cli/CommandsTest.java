package com.portkit.cli;

import com.portkit.PortkitCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@code run}, {@code plan}, {@code status} and
 * {@code reset} commands against a project in a temporary directory.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandsTest {

    private static final String FACTS = """
        {
          "external": ["size_t"],
          "symbols": [
            {"name": "Table", "kind": "struct", "file": "table.h", "line": 3, "dependencies": ["size_t"]},
            {"name": "lookup", "kind": "function", "file": "table.c", "line": 10, "dependencies": ["Table"]},
            {"name": "ping", "kind": "function", "file": "cycle.c", "line": 1, "dependencies": ["pong"]},
            {"name": "pong", "kind": "function", "file": "cycle.c", "line": 5, "dependencies": ["ping"]}
          ]
        }
        """;

    private static final String GENERATOR = "cat > /dev/null; echo '{\"status\":\"ok\",\"artifacts\":["
        + "{\"role\":\"bindings\",\"path\":\"src/ffi.rs\",\"content\":\"extern {}\"},"
        + "{\"role\":\"implementation\",\"path\":\"src/lib.rs\",\"content\":\"pub fn f() {}\"},"
        + "{\"role\":\"differential-test\",\"path\":\"fuzz/diff.rs\",\"content\":\"fuzz_target!\"}]}'";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void plan_validFacts_printsProcessingOrder() throws IOException {
        Path config = writeProject("exit 0");

        int exitCode = execute("plan", "-c", config.toString(), "--dependencies");

        assertThat(exitCode).isZero();
        assertThat(output()).contains(
            "Processing order (3 units):",
            "Table (struct)",
            "cycle-ping [cycle of 2]",
            "depends on: Table",
            "✓ Symbol graph is valid");
    }

    @Test
    void plan_unresolvedDependency_returnsError() throws IOException {
        Path config = writeProject("exit 0");
        Files.writeString(tempDir.resolve("facts.json"), """
            {"symbols": [{"name": "lookup", "kind": "function", "dependencies": ["Missing"]}]}
            """);

        int exitCode = execute("plan", "-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Missing");
    }

    @Test
    void run_allUnitsPass_verifiesEverythingAndWritesReports() throws IOException {
        // Given
        Path config = writeProject("test -f {unitDir}/src/lib.rs");

        // When
        int exitCode = execute("run", "-c", config.toString(), "--concurrency", "2");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("3 units: 3 verified, 0 failed, 0 blocked, 0 pending", "✓ All units verified");
        assertThat(tempDir.resolve(".portkit/reports/run-summary.md")).exists();
        assertThat(tempDir.resolve(".portkit/reports/run-summary.json")).exists();

        // And a second run resumes without generating again
        stdout.reset();
        assertThat(execute("run", "-c", config.toString(), "--no-report")).isZero();
        assertThat(output()).doesNotContain("  → ");
    }

    @Test
    void run_compileFails_reportsFailureAndBlockedDependents() throws IOException {
        Path config = writeProject("echo 'error[E0425]: cannot find value' >&2; exit 1");

        int exitCode = execute("run", "-c", config.toString(), "--max-attempts", "2", "--no-report");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_INCOMPLETE);
        assertThat(output()).contains("✗ Porting incomplete", "BLOCKED lookup");
        assertThat(tempDir.resolve(".portkit/reports")).doesNotExist();

        stdout.reset();
        assertThat(execute("status", "-c", config.toString(), "Table")).isZero();
        assertThat(output()).contains("Status:    FAILED", "Attempts:  2", "error[E0425]");
    }

    @Test
    void status_noCheckpoints_saysSo() throws IOException {
        Path config = writeProject("exit 0");

        assertThat(execute("status", "-c", config.toString())).isZero();
        assertThat(output()).contains("No checkpoints found");
    }

    @Test
    void reset_failedUnit_allowsFreshRetry() throws IOException {
        // Given: Table failed in an earlier run
        Path config = writeProject("exit 1");
        execute("run", "-c", config.toString(), "--max-attempts", "1", "--no-report");
        stdout.reset();

        // When
        int exitCode = execute("reset", "-c", config.toString(), "Table", "nonexistent");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(output()).contains("✓ Reset Table");
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("No checkpoint for unit: nonexistent");

        stdout.reset();
        execute("status", "-c", config.toString(), "Table");
        assertThat(output()).contains("Status:    UNSTARTED", "Attempts:  0");
    }

    private int execute(String... args) {
        return PortkitCLI.commandLine().execute(args);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private Path writeProject(String compileScript) throws IOException {
        Files.writeString(tempDir.resolve("facts.json"), FACTS);
        Path config = tempDir.resolve("portkit.yaml");
        Files.writeString(config, """
            project:
              name: "table-port"
            facts:
              path: "facts.json"
            orchestrator:
              shutdownGraceSeconds: 5
            retry:
              infrastructureRetries: 0
              initialBackoffMillis: 1
              maxBackoffMillis: 1
            generation:
              backend: command
              command: ["sh", "-c", "%s"]
              timeoutSeconds: 20
            validation:
              compileCommand: ["sh", "-c", "%s"]
              timeoutSeconds: 20
            """.formatted(yamlEscape(GENERATOR), yamlEscape(compileScript)));
        return config;
    }

    private static String yamlEscape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
