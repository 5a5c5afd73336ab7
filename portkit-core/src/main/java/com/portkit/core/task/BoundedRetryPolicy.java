package com.portkit.core.task;

import com.portkit.core.config.PortkitConfig.RetrySettings;
import com.portkit.core.model.Verdict;

import java.time.Duration;

/**
 * Retry policy with separate budgets for defects and infrastructure problems.
 *
 * <p>Compile failures and behavioral mismatches consume generation attempts.
 * Runner errors re-validate the same artifacts without regenerating, with
 * exponential backoff, up to {@code infrastructureRetries} times per artifact set.
 *
 * @param maxAttempts generation attempts per unit
 * @param infrastructureRetries re-validations per artifact set
 * @param initialBackoff wait before the first re-validation
 * @param maxBackoff cap on the doubling wait
 */
public record BoundedRetryPolicy(
    int maxAttempts,
    int infrastructureRetries,
    Duration initialBackoff,
    Duration maxBackoff
) implements RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final int DEFAULT_INFRASTRUCTURE_RETRIES = 3;

    /**
     * Compact constructor with validation.
     */
    public BoundedRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (infrastructureRetries < 0) {
            throw new IllegalArgumentException("infrastructureRetries must not be negative, got " + infrastructureRetries);
        }
        if (initialBackoff == null) {
            initialBackoff = Duration.ofSeconds(1);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
    }

    public static BoundedRetryPolicy defaults() {
        return new BoundedRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INFRASTRUCTURE_RETRIES,
            Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public static BoundedRetryPolicy from(RetrySettings settings) {
        return new BoundedRetryPolicy(settings.maxAttempts(), settings.infrastructureRetries(),
            Duration.ofMillis(settings.initialBackoffMillis()), Duration.ofMillis(settings.maxBackoffMillis()));
    }

    @Override
    public Transition onVerdict(Verdict verdict, int attempt, int infrastructureRetriesUsed) {
        return switch (verdict.type()) {
            case PASS -> Transition.ADVANCE;
            case COMPILE_FAILURE, BEHAVIORAL_MISMATCH ->
                attempt < maxAttempts ? Transition.RETRY_WITH_FEEDBACK : Transition.FAIL;
            case RUNNER_ERROR ->
                infrastructureRetriesUsed < infrastructureRetries ? Transition.REVALIDATE : Transition.FAIL;
        };
    }

    @Override
    public Transition onGenerationFailure(int attempt) {
        return attempt < maxAttempts ? Transition.RETRY_WITH_FEEDBACK : Transition.FAIL;
    }

    @Override
    public Duration backoff(int infrastructureRetry) {
        int exponent = Math.max(0, Math.min(infrastructureRetry - 1, 30));
        Duration wait = initialBackoff.multipliedBy(1L << exponent);
        return wait.compareTo(maxBackoff) > 0 ? maxBackoff : wait;
    }
}
