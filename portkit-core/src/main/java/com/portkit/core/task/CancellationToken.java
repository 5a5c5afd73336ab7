package com.portkit.core.task;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared by the orchestrator and its tasks.
 *
 * <p>Cancellation is only observed at checkpoint boundaries; work in progress
 * (a generation request, a validation step) always runs to completion.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits until cancelled or until the duration elapses, whichever comes first.
     *
     * @param duration maximum wait
     * @return true if cancellation was requested
     */
    public boolean awaitCancellation(Duration duration) {
        try {
            return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isCancelled();
        }
    }
}
