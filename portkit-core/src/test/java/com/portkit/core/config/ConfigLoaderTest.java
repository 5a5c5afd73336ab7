package com.portkit.core.config;

import com.portkit.core.validation.LinkMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("portkit.yaml");
        Files.writeString(configFile, """
            project:
              name: "zopfli"
              directory: "rust"

            facts:
              path: "build/facts.json"
              external: [size_t, malloc]

            orchestrator:
              concurrency: 4

            retry:
              maxAttempts: 5
              infrastructureRetries: 2

            generation:
              command: ["python3", "tools/generate.py"]
              timeoutSeconds: 300

            validation:
              compileCommand: ["cargo", "build"]
              testCommand: ["cargo", "fuzz", "run", "{testTarget}"]
              linkMode: ALWAYS
              timeoutSeconds: 90
            """);

        PortkitConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("zopfli");
        assertThat(config.project().directory()).isEqualTo("rust");
        assertThat(config.facts().path()).isEqualTo("build/facts.json");
        assertThat(config.facts().external()).containsExactly("size_t", "malloc");
        assertThat(config.orchestrator().concurrency()).isEqualTo(4);
        assertThat(config.retry().maxAttempts()).isEqualTo(5);
        assertThat(config.retry().infrastructureRetries()).isEqualTo(2);
        assertThat(config.generation().backend()).isEqualTo("command");
        assertThat(config.generation().command()).containsExactly("python3", "tools/generate.py");
        assertThat(config.generation().timeoutSeconds()).isEqualTo(300);
        assertThat(config.validation().compileCommand()).containsExactly("cargo", "build");
        assertThat(config.validation().linkCommand()).isEmpty();
        assertThat(config.validation().linkMode()).isEqualTo(LinkMode.ALWAYS);
        assertThat(config.validation().timeoutSeconds()).isEqualTo(90);
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("portkit.yaml");
        Files.writeString(configFile, """
            project:
              name: "minimal"
            """);

        PortkitConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.project().directory()).isEqualTo(".");
        assertThat(config.checkpoint().directory()).isEqualTo(".portkit/checkpoints");
        assertThat(config.orchestrator().concurrency()).isEqualTo(1);
        assertThat(config.retry().maxAttempts()).isEqualTo(10);
        assertThat(config.validation().linkMode()).isEqualTo(LinkMode.WHEN_DEPENDENTS);
        assertThat(config.validation().maxDiagnosticChars()).isEqualTo(8_000);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        PortkitConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(PortkitConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("portkit.yaml");
        Files.writeString(configFile, """
            orchestrator: [
              unclosed
            """);

        PortkitConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(PortkitConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("portkit.yaml");
        Files.writeString(configFile, "");

        PortkitConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(PortkitConfig.defaults());
    }

    @Test
    void load_nonPositiveConcurrency_fallsBackToOne() throws IOException {
        Path configFile = tempDir.resolve("portkit.yaml");
        Files.writeString(configFile, """
            orchestrator:
              concurrency: 0
            """);

        PortkitConfig config = ConfigLoader.load(configFile);

        assertThat(config.orchestrator().concurrency()).isEqualTo(1);
    }

    @Test
    void projectLayout_relativePaths_resolveAgainstConfigDirectory() {
        PortkitConfig config = PortkitConfig.defaults();

        ProjectLayout layout = ProjectLayout.of(config, tempDir);

        assertThat(layout.projectDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(layout.factsPath()).isEqualTo(tempDir.toAbsolutePath().resolve("facts.json").normalize());
        assertThat(layout.checkpointDir()).endsWith(Path.of(".portkit", "checkpoints"));
    }
}
