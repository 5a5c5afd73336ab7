package com.portkit.core.task;

import com.portkit.core.model.Verdict;

import java.time.Duration;

/**
 * Maps attempt outcomes to transitions. Every verdict maps to exactly one transition.
 */
public interface RetryPolicy {

    /**
     * @return generation attempts allowed per unit
     */
    int maxAttempts();

    /**
     * Decides what follows a validation verdict.
     *
     * @param verdict validation verdict
     * @param attempt current attempt number
     * @param infrastructureRetriesUsed re-validations already spent on this artifact set
     * @return transition
     */
    Transition onVerdict(Verdict verdict, int attempt, int infrastructureRetriesUsed);

    /**
     * Decides what follows a refused, failed or incomplete generation.
     *
     * @param attempt current attempt number
     * @return {@link Transition#RETRY_WITH_FEEDBACK} or {@link Transition#FAIL}
     */
    Transition onGenerationFailure(int attempt);

    /**
     * Wait before the given re-validation.
     *
     * @param infrastructureRetry re-validation number, starting at 1
     * @return backoff duration
     */
    Duration backoff(int infrastructureRetry);
}
