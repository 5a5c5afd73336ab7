package com.portkit.core.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated result of one orchestrator run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RunSummary summary = orchestrator.run(graph, store, 4);
 * if (!summary.allVerified()) {
 *     summary.failures().forEach(o -> log.warn("{}: {}", o.unitId(), o.lastError()));
 * }
 * }</pre>
 *
 * @param outcomes one outcome per processing unit, in topological order
 * @param dispatchOrder unit ids in the order this run started working on them
 * @param interrupted true if the run stopped on cancellation before every unit was decided
 */
public record RunSummary(
    List<UnitOutcome> outcomes,
    List<String> dispatchOrder,
    boolean interrupted
) {
    /**
     * Compact constructor with validation.
     */
    public RunSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        dispatchOrder = dispatchOrder == null ? List.of() : List.copyOf(dispatchOrder);
    }

    /**
     * Counts outcomes per status; every status is present, possibly with zero.
     *
     * @return counts keyed by status
     */
    public Map<OutcomeStatus, Integer> counts() {
        Map<OutcomeStatus, Integer> counts = new EnumMap<>(OutcomeStatus.class);
        for (OutcomeStatus status : OutcomeStatus.values()) {
            counts.put(status, 0);
        }
        outcomes.forEach(o -> counts.merge(o.status(), 1, Integer::sum));
        return counts;
    }

    /**
     * @param status outcome status
     * @return number of units with that status
     */
    public int count(OutcomeStatus status) {
        return counts().get(status);
    }

    /**
     * Returns failed and blocked units, in topological order.
     *
     * @return failure outcomes with their last diagnostic
     */
    public List<UnitOutcome> failures() {
        return outcomes.stream()
            .filter(o -> o.status() == OutcomeStatus.FAILED || o.status() == OutcomeStatus.BLOCKED)
            .toList();
    }

    /**
     * @param unitId processing unit id
     * @return the unit's outcome, if the unit is part of this run
     */
    public Optional<UnitOutcome> outcome(String unitId) {
        return outcomes.stream().filter(o -> o.unitId().equals(unitId)).findFirst();
    }

    /**
     * @return true if every unit is verified
     */
    public boolean allVerified() {
        return outcomes.stream().allMatch(o -> o.status() == OutcomeStatus.VERIFIED);
    }
}
