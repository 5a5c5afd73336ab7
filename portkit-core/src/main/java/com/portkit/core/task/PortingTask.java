package com.portkit.core.task;

import com.portkit.core.checkpoint.CheckpointStore;
import com.portkit.core.generation.ArtifactRequirements;
import com.portkit.core.generation.GenerationException;
import com.portkit.core.generation.GenerationFeedback;
import com.portkit.core.generation.GenerationRequest;
import com.portkit.core.generation.GenerationResponse;
import com.portkit.core.model.ArtifactRole;
import com.portkit.core.model.ArtifactSet;
import com.portkit.core.model.ErrorKind;
import com.portkit.core.model.ErrorSummary;
import com.portkit.core.model.PortingStatus;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.Verdict;
import com.portkit.core.util.Fingerprints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * State machine porting one processing unit: generate, validate, then retry,
 * advance or fail.
 *
 * <p>Every state change is written to the checkpoint store before the task
 * moves on. Cancellation is checked at the end of each generating and
 * validating step; an interrupted task leaves a record from which a later run
 * can resume.
 *
 * <p>Collaborator and validation runner failures never escape: they become
 * error summaries and feed the retry policy. Only checkpoint storage failures
 * propagate.
 */
public class PortingTask implements Callable<TaskResult> {

    private static final Logger log = LoggerFactory.getLogger(PortingTask.class);

    private final ProcessingUnit unit;
    private final ResumePoint resumePoint;
    private final Map<String, ArtifactSet> dependencyArtifacts;
    private final CheckpointStore store;
    private final TaskServices services;
    private final CancellationToken token;
    private final Set<ArtifactRole> requiredRoles;

    private volatile PortingStatus status = PortingStatus.UNSTARTED;

    /**
     * @param unit unit to port
     * @param resumePoint where to start
     * @param dependencyArtifacts verified artifact sets of every dependency unit
     * @param store checkpoint store
     * @param services shared collaborators
     * @param token cancellation token
     */
    public PortingTask(ProcessingUnit unit,
                       ResumePoint resumePoint,
                       Map<String, ArtifactSet> dependencyArtifacts,
                       CheckpointStore store,
                       TaskServices services,
                       CancellationToken token) {
        this.unit = unit;
        this.resumePoint = resumePoint;
        this.dependencyArtifacts = Map.copyOf(dependencyArtifacts);
        this.store = store;
        this.services = services;
        this.token = token;
        this.requiredRoles = ArtifactRequirements.forUnit(unit, services.requireTestForDataTypes());
    }

    /**
     * @return current in-memory status of the task
     */
    public PortingStatus status() {
        return status;
    }

    public ProcessingUnit unit() {
        return unit;
    }

    /**
     * Runs the unit to a terminal state, or until cancellation is observed.
     *
     * @return task result
     * @throws IllegalStateException if a dependency unit is not verified
     * @throws com.portkit.core.checkpoint.CheckpointStorageException if a checkpoint cannot be written
     */
    @Override
    public TaskResult call() {
        checkDependenciesVerified();

        RetryPolicy policy = services.retryPolicy();
        int attempt = resumePoint.completedAttempts();
        ErrorSummary lastError = resumePoint.carriedError();
        GenerationFeedback feedback = lastError == null
            ? null
            : new GenerationFeedback(attempt, List.of(lastError), false);
        Map<ArtifactRole, String> previousFingerprints = resumePoint.previousFingerprints();

        while (true) {
            attempt++;
            moveTo(PortingStatus.GENERATING);
            store.record(unit, PortingStatus.GENERATING, attempt, Map.of(), lastError);
            log.info("Generating {} (attempt {}/{})", unit.id(), attempt, policy.maxAttempts());

            Generated generated = generate(attempt, feedback);
            if (generated.error() != null) {
                if (token.isCancelled()) {
                    log.info("Generation of {} ended after cancellation: {}", unit.id(), generated.error().headline());
                    return interrupted(attempt, lastError);
                }
                lastError = generated.error();
                log.warn("Generation of {} failed on attempt {}: {}", unit.id(), attempt, lastError.headline());
                if (policy.onGenerationFailure(attempt) == Transition.FAIL) {
                    return fail(attempt, Map.of(), lastError);
                }
                feedback = new GenerationFeedback(attempt, List.of(lastError), false);
                if (token.isCancelled()) {
                    return interruptAfterFailedAttempt(attempt, Map.of(), lastError);
                }
                continue;
            }

            ArtifactSet artifacts = generated.artifacts();
            Map<ArtifactRole, String> fingerprints = Fingerprints.of(artifacts);
            boolean unchanged = fingerprints.equals(previousFingerprints);
            if (unchanged) {
                log.warn("Attempt {} for {} produced the same artifacts as the previous attempt", attempt, unit.id());
            }
            previousFingerprints = fingerprints;

            moveTo(PortingStatus.VALIDATING);
            store.record(unit, PortingStatus.VALIDATING, attempt, fingerprints, lastError);
            if (token.isCancelled()) {
                return interrupted(attempt, lastError);
            }

            Decision decision = validateUntilDecided(artifacts, attempt);
            if (decision == null) {
                return interrupted(attempt, lastError);
            }
            if (!decision.verdict().passed() && token.isCancelled()) {
                log.info("Validation of {} ended after cancellation: {}",
                    unit.id(), decision.verdict().toErrorSummary().headline());
                return interrupted(attempt, lastError);
            }

            switch (decision.transition()) {
                case ADVANCE -> {
                    moveTo(PortingStatus.VERIFIED);
                    store.record(unit, PortingStatus.VERIFIED, attempt, fingerprints, null);
                    log.info("Verified {} after {} attempt(s)", unit.id(), attempt);
                    return new TaskResult(unit.id(), PortingStatus.VERIFIED, attempt, artifacts, null, false);
                }
                case FAIL -> {
                    return fail(attempt, fingerprints, decision.verdict().toErrorSummary());
                }
                case RETRY_WITH_FEEDBACK -> {
                    lastError = decision.verdict().toErrorSummary();
                    feedback = new GenerationFeedback(attempt, List.of(lastError), unchanged);
                    log.info("Attempt {} for {} failed validation ({}); retrying with feedback",
                        attempt, unit.id(), lastError.kind());
                    if (token.isCancelled()) {
                        return interruptAfterFailedAttempt(attempt, fingerprints, lastError);
                    }
                }
                case REVALIDATE -> throw new IllegalStateException("Re-validation must be decided before leaving validation");
            }
        }
    }

    private void checkDependenciesVerified() {
        List<String> missing = unit.dependencyUnitIds().stream()
            .filter(id -> !dependencyArtifacts.containsKey(id))
            .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                "Unit " + unit.id() + " cannot start generating: dependencies not verified: " + missing);
        }
    }

    private Generated generate(int attempt, GenerationFeedback feedback) {
        GenerationRequest request = new GenerationRequest(unit, attempt, requiredRoles, dependencyArtifacts, feedback);
        GenerationResponse response;
        try {
            response = services.collaborator().generate(request);
        } catch (GenerationException e) {
            return Generated.failed("Generation failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Collaborator failed unexpectedly for {}", unit.id(), e);
            return Generated.failed("Collaborator error: " + e);
        }

        if (response == null) {
            return Generated.failed("Collaborator returned no response");
        }
        if (!response.accepted()) {
            return Generated.failed("Collaborator refused: " + response.reason());
        }
        List<ArtifactRole> missing = response.artifacts().missing(requiredRoles);
        if (!missing.isEmpty()) {
            return Generated.failed("Incomplete artifact set: missing "
                + missing.stream().map(ArtifactRole::label).collect(Collectors.joining(", ")));
        }

        try {
            services.workspace().write(unit.id(), response.artifacts());
        } catch (IllegalArgumentException | UncheckedIOException e) {
            return Generated.failed("Could not write artifacts: " + e.getMessage());
        }
        return new Generated(response.artifacts(), null);
    }

    /**
     * Validates, re-validating after runner errors while the policy allows.
     *
     * @return final verdict and transition, or null if cancelled during a backoff
     */
    private Decision validateUntilDecided(ArtifactSet artifacts, int attempt) {
        RetryPolicy policy = services.retryPolicy();
        int infrastructureRetries = 0;
        while (true) {
            Verdict verdict = runValidation(artifacts);
            Transition transition = policy.onVerdict(verdict, attempt, infrastructureRetries);
            if (transition != Transition.REVALIDATE) {
                return new Decision(verdict, transition);
            }

            infrastructureRetries++;
            Duration wait = policy.backoff(infrastructureRetries);
            log.warn("Validation runner error for {} ({}); re-validating in {} ms",
                unit.id(), verdict.toErrorSummary().headline(), wait.toMillis());
            if (token.awaitCancellation(wait)) {
                return null;
            }
        }
    }

    private Verdict runValidation(ArtifactSet artifacts) {
        try {
            Verdict verdict = services.validationRunner().validate(unit, artifacts);
            return verdict != null ? verdict : Verdict.runnerError("", "Validation runner returned no verdict");
        } catch (RuntimeException e) {
            log.warn("Validation runner failed unexpectedly for {}", unit.id(), e);
            return Verdict.runnerError("", "Validation runner error: " + e);
        }
    }

    private TaskResult fail(int attempt, Map<ArtifactRole, String> fingerprints, ErrorSummary error) {
        moveTo(PortingStatus.FAILED);
        store.record(unit, PortingStatus.FAILED, attempt, fingerprints, error);
        log.warn("Unit {} failed after {} attempt(s): {}", unit.id(), attempt, error.headline());
        try {
            services.workspace().clear(unit.id());
        } catch (UncheckedIOException e) {
            log.warn("Could not remove artifacts of failed unit {}: {}", unit.id(), e.getMessage());
        }
        return new TaskResult(unit.id(), PortingStatus.FAILED, attempt, ArtifactSet.empty(), error, false);
    }

    /**
     * Persists a failed attempt that still has retries left as {@code FAILED},
     * so the next run continues after it.
     */
    private TaskResult interruptAfterFailedAttempt(int attempt, Map<ArtifactRole, String> fingerprints, ErrorSummary error) {
        moveTo(PortingStatus.FAILED);
        store.record(unit, PortingStatus.FAILED, attempt, fingerprints, error);
        log.info("Stopping {} after attempt {} on cancellation", unit.id(), attempt);
        return new TaskResult(unit.id(), PortingStatus.FAILED, attempt, ArtifactSet.empty(), error, true);
    }

    /**
     * Leaves the in-flight {@code GENERATING} or {@code VALIDATING} record in place, so
     * the next run repeats this attempt without counting it.
     */
    private TaskResult interrupted(int attempt, ErrorSummary lastError) {
        log.info("Stopping {} during attempt {} on cancellation", unit.id(), attempt);
        return new TaskResult(unit.id(), status, attempt, ArtifactSet.empty(), lastError, true);
    }

    private void moveTo(PortingStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for " + unit.id() + ": " + status + " -> " + next);
        }
        status = next;
    }

    private record Generated(ArtifactSet artifacts, ErrorSummary error) {
        static Generated failed(String message) {
            return new Generated(null, new ErrorSummary(ErrorKind.GENERATION_INCOMPLETE, message));
        }
    }

    private record Decision(Verdict verdict, Transition transition) {
    }
}
