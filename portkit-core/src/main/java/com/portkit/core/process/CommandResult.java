package com.portkit.core.process;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Captured result of an external command.
 *
 * @param command command line that was run
 * @param exitCode process exit code, or -1 if the process was killed on timeout
 * @param stdout standard output (also holds stderr when the streams were merged)
 * @param stderr standard error, empty when merged into stdout
 * @param duration wall-clock duration
 * @param timedOut true if the process was killed on timeout
 */
public record CommandResult(
    List<String> command,
    int exitCode,
    String stdout,
    String stderr,
    Duration duration,
    boolean timedOut
) {
    /**
     * Compact constructor with defaults.
     */
    public CommandResult {
        command = command == null ? List.of() : List.copyOf(command);
        stdout = Objects.requireNonNullElse(stdout, "");
        stderr = Objects.requireNonNullElse(stderr, "");
        duration = Objects.requireNonNullElse(duration, Duration.ZERO);
    }

    /**
     * @return true if the process finished with exit code 0
     */
    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Returns stdout and stderr joined, for diagnostics.
     *
     * @return combined output
     */
    public String combinedOutput() {
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return stderr;
        }
        return stdout + (stdout.endsWith("\n") ? "" : "\n") + stderr;
    }

    /**
     * @return command line joined with spaces, for log messages
     */
    public String commandLine() {
        return String.join(" ", command);
    }
}
