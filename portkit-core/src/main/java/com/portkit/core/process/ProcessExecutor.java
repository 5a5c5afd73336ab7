package com.portkit.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a timeout, capturing their output.
 *
 * <p>Output streams are drained on background threads so a chatty process cannot
 * block on a full pipe. On timeout the process is destroyed forcibly and the
 * output captured so far is returned with {@link CommandResult#timedOut()} set.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CommandResult result = new ProcessExecutor().execute(
 *     List.of("cargo", "build"), projectDir, Duration.ofSeconds(60));
 * if (!result.succeeded()) {
 *     log.warn("Build failed:\n{}", result.combinedOutput());
 * }
 * }</pre>
 */
public class ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);
    private static final long STREAM_DRAIN_MILLIS = 5_000;

    /**
     * Runs a command with stderr merged into stdout, in output order.
     *
     * @param command command line
     * @param workingDirectory working directory
     * @param timeout maximum run time
     * @return captured result
     * @throws IOException if the process cannot be started, or the wait is interrupted
     */
    public CommandResult execute(List<String> command, Path workingDirectory, Duration timeout) throws IOException {
        return execute(command, workingDirectory, timeout, null, true);
    }

    /**
     * Runs a command, optionally feeding it standard input.
     *
     * @param command command line
     * @param workingDirectory working directory
     * @param timeout maximum run time
     * @param input text written to the process's stdin (UTF-8), or null for none
     * @param mergeErrorStream true to merge stderr into stdout
     * @return captured result
     * @throws IOException if the process cannot be started, or the wait is interrupted
     */
    public CommandResult execute(List<String> command,
                                 Path workingDirectory,
                                 Duration timeout,
                                 String input,
                                 boolean mergeErrorStream) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }

        long start = System.nanoTime();
        log.debug("Executing: {} (in {}, timeout {}s)", String.join(" ", command), workingDirectory, timeout.toSeconds());

        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(workingDirectory.toFile())
            .redirectErrorStream(mergeErrorStream);
        if (input == null) {
            builder.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        }

        Process process = builder.start();

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread outReader = drain(process.getInputStream(), stdout, "portkit-process-out");
        Thread errReader = mergeErrorStream ? null : drain(process.getErrorStream(), stderr, "portkit-process-err");
        Thread inWriter = input == null ? null : feed(process.getOutputStream(), input);

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(STREAM_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
                log.warn("Process timed out after {}s: {}", timeout.toSeconds(), String.join(" ", command));
            }
            join(outReader);
            join(errReader);
            join(inWriter);

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            int exitCode = finished ? process.exitValue() : -1;
            log.debug("Process finished with exit code {} in {} ms", exitCode, duration.toMillis());
            return new CommandResult(command, exitCode, text(stdout), text(stderr), duration, !finished);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException(
                "Interrupted while waiting for: " + String.join(" ", command));
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private static Thread drain(InputStream stream, ByteArrayOutputStream sink, String name) {
        Thread reader = new Thread(() -> {
            try (InputStream in = stream) {
                byte[] buffer = new byte[8192];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    synchronized (sink) {
                        sink.write(buffer, 0, read);
                    }
                }
            } catch (IOException e) {
                log.debug("Stopped reading process output: {}", e.getMessage());
            }
        }, name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private static Thread feed(OutputStream stream, String input) {
        Thread writer = new Thread(() -> {
            try (OutputStream out = stream) {
                out.write(input.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.debug("Process closed stdin early: {}", e.getMessage());
            }
        }, "portkit-process-in");
        writer.setDaemon(true);
        writer.start();
        return writer;
    }

    private static void join(Thread thread) throws InterruptedException {
        if (thread != null) {
            thread.join(STREAM_DRAIN_MILLIS);
        }
    }

    private static String text(ByteArrayOutputStream sink) {
        synchronized (sink) {
            return sink.toString(StandardCharsets.UTF_8);
        }
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
