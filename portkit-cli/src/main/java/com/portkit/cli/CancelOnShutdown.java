package com.portkit.cli;

import com.portkit.core.task.CancellationToken;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * JVM shutdown hook that turns Ctrl-C into cooperative cancellation.
 *
 * <p>Cancels the run's token, then holds the JVM open until the run has
 * persisted its in-flight units or the grace period runs out.
 * Registered via {@code Runtime.getRuntime().addShutdownHook()}.
 */
class CancelOnShutdown implements Runnable {

    private final CancellationToken token;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);

    CancelOnShutdown(CancellationToken token, Duration grace) {
        this.token = token;
        this.grace = grace;
    }

    @Override
    public void run() {
        if (finished.getCount() == 0) {
            return;
        }
        System.err.println();
        System.err.println("⚠ Interrupt received: finishing in-flight units (up to " + grace.toSeconds() + "s)...");
        token.cancel();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                System.err.println("✗ Grace period expired; in-flight units resume from their last checkpoint");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Signals that the run has returned and all checkpoints are written.
     */
    void runFinished() {
        finished.countDown();
    }
}
