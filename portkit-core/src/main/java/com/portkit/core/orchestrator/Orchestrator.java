package com.portkit.core.orchestrator;

import com.portkit.core.checkpoint.CheckpointStorageException;
import com.portkit.core.checkpoint.CheckpointStore;
import com.portkit.core.checkpoint.ResumeDecision;
import com.portkit.core.graph.SymbolGraph;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.CheckpointRecord;
import com.portkit.core.model.ErrorKind;
import com.portkit.core.model.ErrorSummary;
import com.portkit.core.model.OutcomeStatus;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.RunSummary;
import com.portkit.core.model.UnitOutcome;
import com.portkit.core.task.CancellationToken;
import com.portkit.core.task.PortingTask;
import com.portkit.core.task.ResumePoint;
import com.portkit.core.task.TaskResult;
import com.portkit.core.task.TaskServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks a symbol graph in dependency order and ports every unit.
 *
 * <p>The calling thread is the single coordinator: it keeps the ready set,
 * dispatches up to {@code concurrencyLimit} porting tasks to a worker pool and
 * reacts to each completion. A unit becomes ready once every unit it depends on
 * is verified; among ready units the one earliest in topological order is
 * dispatched first, so a limit of 1 follows {@link SymbolGraph#order()} exactly.
 *
 * <p>When a unit fails, all of its transitive dependents are reported as
 * blocked and never dispatched. On cancellation no new unit is dispatched;
 * units in flight run to their next checkpoint boundary and everything left
 * undecided is reported as pending.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Orchestrator orchestrator = new Orchestrator(services, token);
 * RunSummary summary = orchestrator.run(graph, new FileCheckpointStore(dir), 4);
 * }</pre>
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final TaskServices services;
    private final CancellationToken token;
    private final List<RunListener> listeners = new ArrayList<>();

    public Orchestrator(TaskServices services, CancellationToken token) {
        this.services = services;
        this.token = token;
    }

    /**
     * Registers a listener for dispatch and completion events.
     *
     * @param listener listener, called on the coordinator thread
     * @return this orchestrator
     */
    public Orchestrator addListener(RunListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Runs or resumes porting of every unit in the graph.
     *
     * @param graph symbol graph
     * @param store checkpoint store; the only state carried between runs
     * @param concurrencyLimit maximum units in flight
     * @return summary with one outcome per unit
     * @throws CheckpointStorageException if checkpoint state cannot be read or written;
     *     in-flight units are drained first
     */
    public RunSummary run(SymbolGraph graph, CheckpointStore store, int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1, got " + concurrencyLimit);
        }

        RunState state = reconcile(graph, store);
        log.info("Starting run: {} units, {} already decided, concurrency {}",
            graph.size(), state.outcomes.size(), concurrencyLimit);

        for (ProcessingUnit unit : graph.order()) {
            if (!state.outcomes.containsKey(unit.id()) && state.isReady(unit)) {
                state.ready.add(graph.topologicalIndex(unit.id()));
            }
        }

        ExecutorService pool = Executors.newFixedThreadPool(concurrencyLimit, new WorkerThreadFactory());
        CompletionService<TaskResult> completions = new ExecutorCompletionService<>(pool);
        Map<Future<TaskResult>, ProcessingUnit> inFlight = new HashMap<>();
        List<String> dispatchOrder = new ArrayList<>();
        RuntimeException fatal = null;
        boolean coordinatorInterrupted = false;

        try {
            while (true) {
                while (fatal == null && !token.isCancelled()
                    && inFlight.size() < concurrencyLimit && !state.ready.isEmpty()) {
                    ProcessingUnit unit = graph.order().get(state.ready.pollFirst());
                    PortingTask task = new PortingTask(unit,
                        state.resumePoints.getOrDefault(unit.id(), ResumePoint.fresh()),
                        state.dependencyArtifacts(unit), store, services, token);
                    inFlight.put(completions.submit(task), unit);
                    dispatchOrder.add(unit.id());
                    log.debug("Dispatched {} ({} in flight)", unit.id(), inFlight.size());
                    listeners.forEach(l -> l.unitDispatched(unit));
                }

                if (inFlight.isEmpty()) {
                    break;
                }

                Future<TaskResult> completed;
                try {
                    completed = completions.take();
                } catch (InterruptedException e) {
                    log.warn("Coordinator interrupted; cancelling run and draining in-flight units");
                    coordinatorInterrupted = true;
                    token.cancel();
                    continue;
                }

                ProcessingUnit unit = inFlight.remove(completed);
                try {
                    handle(graph, state, unit, completed.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.error("Porting task for {} aborted: {}", unit.id(), cause.getMessage(), cause);
                    if (fatal == null) {
                        fatal = cause instanceof RuntimeException runtime
                            ? runtime
                            : new IllegalStateException("Porting task for " + unit.id() + " aborted", cause);
                    }
                    token.cancel();
                } catch (InterruptedException e) {
                    coordinatorInterrupted = true;
                    token.cancel();
                }
            }
        } finally {
            pool.shutdown();
            if (coordinatorInterrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (fatal != null) {
            throw fatal;
        }

        RunSummary summary = summarize(graph, store, state, dispatchOrder);
        log.info("Run finished: {}", summary.counts());
        return summary;
    }

    /**
     * Applies stored checkpoints before dispatching anything.
     */
    private RunState reconcile(SymbolGraph graph, CheckpointStore store) {
        Map<String, CheckpointRecord> records = store.load();
        int maxAttempts = services.retryPolicy().maxAttempts();
        RunState state = new RunState();

        records.keySet().stream()
            .filter(id -> graph.unit(id).isEmpty())
            .forEach(id -> log.warn("Ignoring checkpoint for unit '{}' which is not in the symbol graph", id));

        for (ProcessingUnit unit : graph.order()) {
            CheckpointRecord record = records.get(unit.id());
            ResumeDecision decision = ResumeDecision.of(Optional.ofNullable(record), maxAttempts);
            switch (decision) {
                case SKIP_VERIFIED -> {
                    ArtifactSet artifacts = services.workspace().read(unit.id()).orElseGet(() -> {
                        log.warn("Verified unit {} has no artifact manifest; dependents get no artifacts for it", unit.id());
                        return ArtifactSet.empty();
                    });
                    state.verifiedArtifacts.put(unit.id(), artifacts);
                    state.outcomes.put(unit.id(), new UnitOutcome(unit.id(), unit.memberNames(),
                        OutcomeStatus.VERIFIED, record.attemptCount(), null, true));
                }
                case EXHAUSTED -> {
                    log.info("Unit {} already failed after {} attempts; not retrying", unit.id(), record.attemptCount());
                    state.outcomes.put(unit.id(), new UnitOutcome(unit.id(), unit.memberNames(),
                        OutcomeStatus.FAILED, record.attemptCount(), record.lastError(), true));
                }
                case FRESH -> state.resumePoints.put(unit.id(),
                    record == null ? ResumePoint.fresh() : ResumePoint.from(decision, record));
                case RETRY_FAILED, RESTART_IN_FLIGHT -> {
                    log.info("Resuming {} ({}, {} attempts recorded)", unit.id(), decision, record.attemptCount());
                    state.resumePoints.put(unit.id(), ResumePoint.from(decision, record));
                }
            }
        }

        for (ProcessingUnit unit : graph.order()) {
            UnitOutcome outcome = state.outcomes.get(unit.id());
            if (outcome != null && outcome.status() == OutcomeStatus.FAILED) {
                block(graph, state, unit, outcome.lastError());
            }
        }
        return state;
    }

    private void handle(SymbolGraph graph, RunState state, ProcessingUnit unit, TaskResult result) {
        if (result.interrupted()) {
            log.info("Unit {} interrupted at {} (attempt {})", unit.id(), result.status(), result.attempts());
        } else if (result.verified()) {
            state.verifiedArtifacts.put(unit.id(), result.artifacts());
            state.outcomes.put(unit.id(), new UnitOutcome(unit.id(), unit.memberNames(),
                OutcomeStatus.VERIFIED, result.attempts(), null, false));
            for (ProcessingUnit dependent : graph.dependents(unit.id())) {
                if (!state.outcomes.containsKey(dependent.id()) && state.isReady(dependent)) {
                    state.ready.add(graph.topologicalIndex(dependent.id()));
                }
            }
        } else {
            state.outcomes.put(unit.id(), new UnitOutcome(unit.id(), unit.memberNames(),
                OutcomeStatus.FAILED, result.attempts(), result.lastError(), false));
            block(graph, state, unit, result.lastError());
        }

        UnitOutcome outcome = state.outcomes.get(unit.id());
        if (outcome != null) {
            listeners.forEach(l -> l.unitCompleted(outcome));
        }
    }

    /**
     * Marks every undecided transitive dependent of a failed unit as blocked.
     */
    private void block(SymbolGraph graph, RunState state, ProcessingUnit failed, ErrorSummary cause) {
        String detail = cause == null ? "no diagnostic recorded" : cause.headline();
        ErrorSummary reason = new ErrorSummary(ErrorKind.CHAIN_BLOCKED,
            "dependency unit '" + failed.id() + "' failed: " + detail);
        for (ProcessingUnit dependent : graph.transitiveDependents(failed.id())) {
            if (!state.outcomes.containsKey(dependent.id())) {
                log.debug("Blocking {}: {}", dependent.id(), reason.message());
                state.outcomes.put(dependent.id(), new UnitOutcome(dependent.id(), dependent.memberNames(),
                    OutcomeStatus.BLOCKED, 0, reason, false));
                state.ready.remove(graph.topologicalIndex(dependent.id()));
            }
        }
    }

    private RunSummary summarize(SymbolGraph graph, CheckpointStore store, RunState state, List<String> dispatchOrder) {
        List<UnitOutcome> outcomes = new ArrayList<>(graph.size());
        boolean pending = false;
        for (ProcessingUnit unit : graph.order()) {
            UnitOutcome outcome = state.outcomes.get(unit.id());
            if (outcome == null) {
                pending = true;
                Optional<CheckpointRecord> record = store.find(unit.id());
                outcome = new UnitOutcome(unit.id(), unit.memberNames(), OutcomeStatus.PENDING,
                    record.map(CheckpointRecord::attemptCount).orElse(0),
                    record.map(CheckpointRecord::lastError).orElse(null), false);
            } else if (outcome.status() == OutcomeStatus.BLOCKED) {
                int attempts = store.find(unit.id()).map(CheckpointRecord::attemptCount).orElse(0);
                outcome = new UnitOutcome(outcome.unitId(), outcome.symbols(), outcome.status(), attempts,
                    outcome.lastError(), outcome.resumed());
            }
            outcomes.add(outcome);
        }
        return new RunSummary(outcomes, dispatchOrder, pending && token.isCancelled());
    }

    /**
     * Mutable bookkeeping of one run; touched only by the coordinator thread.
     */
    private static final class RunState {
        final Map<String, UnitOutcome> outcomes = new LinkedHashMap<>();
        final Map<String, ArtifactSet> verifiedArtifacts = new HashMap<>();
        final Map<String, ResumePoint> resumePoints = new HashMap<>();
        final TreeSet<Integer> ready = new TreeSet<>();

        boolean isReady(ProcessingUnit unit) {
            return verifiedArtifacts.keySet().containsAll(unit.dependencyUnitIds());
        }

        Map<String, ArtifactSet> dependencyArtifacts(ProcessingUnit unit) {
            Map<String, ArtifactSet> artifacts = new HashMap<>();
            for (String dependency : unit.dependencyUnitIds()) {
                artifacts.put(dependency, verifiedArtifacts.get(dependency));
            }
            return artifacts;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "portkit-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
