package com.portkit.core.orchestrator;

import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.UnitOutcome;

/**
 * Progress callbacks from the orchestrator, invoked on the coordinator thread.
 */
public interface RunListener {

    /**
     * Called when a unit is handed to a worker.
     *
     * @param unit dispatched unit
     */
    default void unitDispatched(ProcessingUnit unit) {
    }

    /**
     * Called when a dispatched unit reaches a final outcome in this run.
     *
     * @param outcome unit outcome
     */
    default void unitCompleted(UnitOutcome outcome) {
    }
}
