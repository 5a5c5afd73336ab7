package com.portkit.core.validation;

import com.portkit.core.artifact.ArtifactWorkspace;
import com.portkit.core.config.PortkitConfig.ValidationSettings;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.Verdict;
import com.portkit.core.model.VerdictType;
import com.portkit.core.process.CommandResult;
import com.portkit.core.process.ProcessExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validation runner that shells out to configured compile and test commands.
 *
 * <p>Commands are argument-list templates; placeholders are replaced per unit:
 * <ul>
 *   <li>{@code {unit}} - unit id</li>
 *   <li>{@code {unitDir}} - the unit's artifact directory</li>
 *   <li>{@code {projectDir}} - target project directory (also the working directory)</li>
 *   <li>{@code {symbols}} - member names, comma separated</li>
 *   <li>{@code {testTarget}} - {@code fuzz_<first member>}</li>
 *   <li>{@code {timeout}} - configured step timeout in seconds</li>
 * </ul>
 *
 * <p>A non-zero exit of a compile step is a compile failure, of the test step a
 * behavioral mismatch. Exit codes 126 and 127 (not executable, not found), a
 * failure to start the process, termination by an external signal and a timeout
 * are runner errors.
 */
public class ProcessValidationRunner implements ValidationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessValidationRunner.class);

    static final String COMPILE_STEP = "compile";
    static final String LINK_STEP = "link";
    static final String TEST_STEP = "test";

    /** Extra time for the test step so a fuzzer bounded by {@code {timeout}} can finish reporting. */
    private static final Duration TEST_GRACE = Duration.ofSeconds(30);

    /** Substituted values are never scanned again; unknown names stay as written. */
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final ValidationSettings settings;
    private final ArtifactWorkspace workspace;
    private final Path projectDir;
    private final Predicate<ProcessingUnit> hasDependents;
    private final ProcessExecutor executor;

    public ProcessValidationRunner(ValidationSettings settings,
                                   ArtifactWorkspace workspace,
                                   Path projectDir,
                                   Predicate<ProcessingUnit> hasDependents) {
        this(settings, workspace, projectDir, hasDependents, new ProcessExecutor());
    }

    public ProcessValidationRunner(ValidationSettings settings,
                                   ArtifactWorkspace workspace,
                                   Path projectDir,
                                   Predicate<ProcessingUnit> hasDependents,
                                   ProcessExecutor executor) {
        this.settings = settings;
        this.workspace = workspace;
        this.projectDir = projectDir;
        this.hasDependents = hasDependents;
        this.executor = executor;
    }

    @Override
    public Verdict validate(ProcessingUnit unit, ArtifactSet artifacts) {
        Map<String, String> variables = variables(unit);
        Duration timeout = Duration.ofSeconds(settings.timeoutSeconds());

        Verdict compiled = runStep(COMPILE_STEP, settings.compileCommand(), variables, timeout, VerdictType.COMPILE_FAILURE);
        if (!compiled.passed()) {
            return compiled;
        }

        if (shouldLink(unit)) {
            Verdict linked = runStep(LINK_STEP, settings.linkCommand(), variables, timeout, VerdictType.COMPILE_FAILURE);
            if (!linked.passed()) {
                return linked;
            }
        } else {
            log.debug("Skipping link step for {} (link mode {})", unit.id(), settings.linkMode());
        }

        if (artifacts.find(ArtifactRole.DIFFERENTIAL_TEST).isEmpty()) {
            log.debug("Skipping differential test for {}: no test artifact", unit.id());
            return Verdict.pass();
        }
        return runStep(TEST_STEP, settings.testCommand(), variables, timeout.plus(TEST_GRACE), VerdictType.BEHAVIORAL_MISMATCH);
    }

    private boolean shouldLink(ProcessingUnit unit) {
        return switch (settings.linkMode()) {
            case ALWAYS -> true;
            case NEVER -> false;
            case WHEN_DEPENDENTS -> hasDependents.test(unit);
        };
    }

    private Verdict runStep(String step,
                            List<String> template,
                            Map<String, String> variables,
                            Duration timeout,
                            VerdictType failureType) {
        if (template.isEmpty()) {
            log.debug("No {} command configured; step skipped", step);
            return Verdict.pass();
        }

        List<String> command = expand(template, variables);
        CommandResult result;
        try {
            result = executor.execute(command, projectDir, timeout);
        } catch (IOException e) {
            log.warn("Could not run {} step for {}: {}", step, variables.get("unit"), e.getMessage());
            return Verdict.runnerError(step, "Failed to run '" + String.join(" ", command) + "': " + e.getMessage());
        }

        if (result.timedOut()) {
            return Verdict.runnerError(step, "Timed out after " + timeout.toSeconds() + "s: "
                + result.commandLine() + "\n" + truncate(result.combinedOutput()));
        }
        if (result.exitCode() == 126 || result.exitCode() == 127) {
            return Verdict.runnerError(step, "Command not executable or not found (exit " + result.exitCode() + "): "
                + result.commandLine() + "\n" + truncate(result.combinedOutput()));
        }
        if (isExternalTermination(result.exitCode())) {
            log.warn("{} step for {} was terminated by signal {}", step, variables.get("unit"), result.exitCode() - 128);
            return Verdict.runnerError(step, "Terminated by signal " + (result.exitCode() - 128) + " (exit "
                + result.exitCode() + "): " + result.commandLine() + "\n" + truncate(result.combinedOutput()));
        }
        if (result.exitCode() != 0) {
            log.info("{} step failed for {} (exit {})", step, variables.get("unit"), result.exitCode());
            String diagnostics = truncate(result.combinedOutput());
            return failureType == VerdictType.BEHAVIORAL_MISMATCH
                ? Verdict.behavioralMismatch(step, diagnostics)
                : Verdict.compileFailure(step, diagnostics);
        }

        log.debug("{} step passed for {} in {} ms", step, variables.get("unit"), result.duration().toMillis());
        return Verdict.pass();
    }

    /**
     * Exit statuses of a process killed by SIGHUP, SIGINT, SIGKILL or SIGTERM, as reported
     * by a shell (128 + signal). Crash signals such as SIGSEGV or SIGABRT stay step failures.
     */
    static boolean isExternalTermination(int exitCode) {
        return switch (exitCode - 128) {
            case 1, 2, 9, 15 -> true;
            default -> false;
        };
    }

    private Map<String, String> variables(ProcessingUnit unit) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("unit", unit.id());
        variables.put("unitDir", workspace.unitDirectory(unit.id()).toAbsolutePath().toString());
        variables.put("projectDir", projectDir.toAbsolutePath().toString());
        variables.put("symbols", String.join(",", unit.memberNames()));
        variables.put("testTarget", "fuzz_" + unit.members().get(0).name());
        variables.put("timeout", String.valueOf(settings.timeoutSeconds()));
        return variables;
    }

    static List<String> expand(List<String> template, Map<String, String> variables) {
        return template.stream()
            .map(argument -> {
                Matcher matcher = PLACEHOLDER.matcher(argument);
                StringBuilder expanded = new StringBuilder();
                while (matcher.find()) {
                    String value = variables.getOrDefault(matcher.group(1), matcher.group());
                    matcher.appendReplacement(expanded, Matcher.quoteReplacement(value));
                }
                matcher.appendTail(expanded);
                return expanded.toString();
            })
            .toList();
    }

    /**
     * Keeps the tail of output longer than the configured limit.
     */
    String truncate(String output) {
        int limit = settings.maxDiagnosticChars();
        if (output.length() <= limit) {
            return output;
        }
        int dropped = output.length() - limit;
        return "... (" + dropped + " characters truncated)\n" + output.substring(dropped);
    }
}
