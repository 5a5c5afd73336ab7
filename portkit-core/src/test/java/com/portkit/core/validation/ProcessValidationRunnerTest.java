package com.portkit.core.validation;

import com.portkit.core.artifact.ArtifactWorkspace;
import com.portkit.core.config.PortkitConfig.ValidationSettings;
import com.portkit.core.facts.SymbolFact;
import com.portkit.core.graph.SymbolGraph;
import com.portkit.core.model.Artifact;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.Verdict;
import com.portkit.core.model.VerdictType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProcessValidationRunner}.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessValidationRunnerTest {

    @TempDir
    Path tempDir;

    private ArtifactWorkspace workspace;
    private ProcessingUnit unit;
    private ArtifactSet withTest;
    private ArtifactSet withoutTest;

    @BeforeEach
    void setUp() {
        workspace = new ArtifactWorkspace(tempDir.resolve("artifacts"));
        unit = SymbolGraph.build(List.of(SymbolFact.of("crc32", "function")), List.of()).order().get(0);
        withTest = new ArtifactSet(List.of(
            new Artifact(ArtifactRole.IMPLEMENTATION, "lib.rs", "fn crc32() {}"),
            new Artifact(ArtifactRole.DIFFERENTIAL_TEST, "fuzz.rs", "fuzz")));
        withoutTest = new ArtifactSet(List.of(
            new Artifact(ArtifactRole.IMPLEMENTATION, "lib.rs", "fn crc32() {}")));
    }

    @Test
    void validate_allStepsSucceed_passes() {
        ValidationSettings settings = settings(sh("true"), sh("true"), sh("true"), LinkMode.ALWAYS, 20);

        Verdict verdict = runner(settings, false).validate(unit, withTest);

        assertThat(verdict.passed()).isTrue();
    }

    @Test
    void validate_compileFails_returnsCompileFailureWithDiagnostics() {
        ValidationSettings settings = settings(sh("echo 'error[E0425]: cannot find value'; exit 101"),
            List.of(), sh("true"), LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.COMPILE_FAILURE);
        assertThat(verdict.step()).isEqualTo(ProcessValidationRunner.COMPILE_STEP);
        assertThat(verdict.detail()).contains("error[E0425]");
    }

    @Test
    void validate_testFails_returnsBehavioralMismatch() {
        ValidationSettings settings = settings(sh("true"), List.of(), sh("echo 'mismatch on input 0x00'; exit 1"),
            LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.BEHAVIORAL_MISMATCH);
        assertThat(verdict.step()).isEqualTo(ProcessValidationRunner.TEST_STEP);
        assertThat(verdict.toErrorSummary().message()).startsWith("[test] mismatch on input");
    }

    @Test
    void validate_noTestArtifact_skipsTestStep() {
        ValidationSettings settings = settings(sh("true"), List.of(), sh("exit 1"), LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withoutTest);

        assertThat(verdict.passed()).isTrue();
    }

    @Test
    void validate_linkWhenDependents_runsOnlyForUnitsWithDependents() {
        ValidationSettings settings = settings(sh("true"), sh("exit 2"), List.of(), LinkMode.WHEN_DEPENDENTS, 20);

        assertThat(runner(settings, false).validate(unit, withoutTest).passed()).isTrue();
        Verdict linked = runner(settings, true).validate(unit, withoutTest);
        assertThat(linked.type()).isEqualTo(VerdictType.COMPILE_FAILURE);
        assertThat(linked.step()).isEqualTo(ProcessValidationRunner.LINK_STEP);
    }

    @Test
    void validate_commandNotFound_returnsRunnerError() {
        ValidationSettings settings = settings(sh("portkit-no-such-compiler"), List.of(), List.of(), LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withoutTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.RUNNER_ERROR);
        assertThat(verdict.detail()).contains("exit 127");
    }

    @Test
    void validate_executableMissing_returnsRunnerError() {
        ValidationSettings settings = settings(List.of("portkit-no-such-compiler"), List.of(), List.of(), LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withoutTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.RUNNER_ERROR);
        assertThat(verdict.detail()).startsWith("Failed to run");
    }

    @Test
    void validate_timeout_returnsRunnerError() {
        ValidationSettings settings = settings(sh("exec sleep 30"), List.of(), List.of(), LinkMode.NEVER, 1);

        Verdict verdict = runner(settings, false).validate(unit, withoutTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.RUNNER_ERROR);
        assertThat(verdict.detail()).startsWith("Timed out after 1s");
    }

    @Test
    void validate_placeholders_areExpanded() throws IOException {
        Path out = tempDir.resolve("args.txt");
        ValidationSettings settings = settings(
            List.of("sh", "-c", "echo \"$1 $2 $3\" > " + out, "sh", "{unit}", "{testTarget}", "{timeout}"),
            List.of(), List.of(), LinkMode.NEVER, 7);

        runner(settings, false).validate(unit, withoutTest);

        assertThat(Files.readString(out).trim()).isEqualTo("crc32 fuzz_crc32 7");
    }

    @Test
    void expand_replacesEveryOccurrence() {
        List<String> expanded = ProcessValidationRunner.expand(
            List.of("--manifest-path", "{unitDir}/Cargo.toml", "{unit}-{unit}"),
            Map.of("unitDir", "/w/f", "unit", "f"));

        assertThat(expanded).containsExactly("--manifest-path", "/w/f/Cargo.toml", "f-f");
    }

    @Test
    void expand_substitutedValueContainingPlaceholder_isNotExpandedAgain() {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("projectDir", "/w/{unit}");
        variables.put("unit", "f");

        List<String> expanded = ProcessValidationRunner.expand(
            List.of("{projectDir}/{unit}", "{unknown}"), variables);

        assertThat(expanded).containsExactly("/w/{unit}/f", "{unknown}");
    }

    @Test
    void validate_compileTerminatedBySignal_returnsRunnerError() {
        ValidationSettings settings = settings(sh("echo partial; kill -TERM $$"), List.of(), List.of(), LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withoutTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.RUNNER_ERROR);
        assertThat(verdict.step()).isEqualTo(ProcessValidationRunner.COMPILE_STEP);
        assertThat(verdict.detail()).contains("signal 15").contains("partial");
    }

    @Test
    void validate_testCrashes_staysBehavioralMismatch() {
        ValidationSettings settings = settings(sh("true"), List.of(), sh("echo 'panicked'; exit 134"), LinkMode.NEVER, 20);

        Verdict verdict = runner(settings, false).validate(unit, withTest);

        assertThat(verdict.type()).isEqualTo(VerdictType.BEHAVIORAL_MISMATCH);
    }

    @Test
    void isExternalTermination_onlyMatchesKillSignals() {
        assertThat(ProcessValidationRunner.isExternalTermination(130)).isTrue();
        assertThat(ProcessValidationRunner.isExternalTermination(137)).isTrue();
        assertThat(ProcessValidationRunner.isExternalTermination(143)).isTrue();
        assertThat(ProcessValidationRunner.isExternalTermination(139)).isFalse();
        assertThat(ProcessValidationRunner.isExternalTermination(1)).isFalse();
    }

    @Test
    void truncate_longOutput_keepsTail() {
        ValidationSettings settings = new ValidationSettings(null, null, null, null, null, 10);

        String truncated = runner(settings, false).truncate("0123456789abcdef");

        assertThat(truncated).isEqualTo("... (6 characters truncated)\n6789abcdef");
    }

    private ProcessValidationRunner runner(ValidationSettings settings, boolean hasDependents) {
        return new ProcessValidationRunner(settings, workspace, tempDir, u -> hasDependents);
    }

    private static ValidationSettings settings(List<String> compile, List<String> link, List<String> test,
                                               LinkMode linkMode, int timeoutSeconds) {
        return new ValidationSettings(compile, link, test, linkMode, timeoutSeconds, 8_000);
    }

    private static List<String> sh(String script) {
        return List.of("sh", "-c", script);
    }
}
