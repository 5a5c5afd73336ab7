package com.portkit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Final state of one unit in a run.
 *
 * @param unitId processing unit id
 * @param symbols member symbol names
 * @param status outcome status
 * @param attempts generation attempts made, across all runs
 * @param lastError last diagnostic for failed or blocked units, otherwise null
 * @param resumed true if the outcome was taken from an earlier run's checkpoint
 */
public record UnitOutcome(
    String unitId,
    List<String> symbols,
    OutcomeStatus status,
    int attempts,
    ErrorSummary lastError,
    boolean resumed
) {
    /**
     * Compact constructor with validation.
     */
    public UnitOutcome {
        Objects.requireNonNull(unitId, "unitId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
