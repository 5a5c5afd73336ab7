package com.portkit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.portkit.core.artifact.ArtifactWorkspace;
import com.portkit.core.checkpoint.CheckpointStore;
import com.portkit.core.checkpoint.FileCheckpointStore;
import com.portkit.core.config.PortkitConfig;
import com.portkit.core.config.ProjectLayout;
import com.portkit.core.generation.GenerationCollaborator;
import com.portkit.core.generation.GenerationCollaborators;
import com.portkit.core.graph.MalformedGraphException;
import com.portkit.core.graph.SymbolGraph;
import com.portkit.core.model.OutcomeStatus;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.RunSummary;
import com.portkit.core.model.UnitOutcome;
import com.portkit.core.orchestrator.Orchestrator;
import com.portkit.core.orchestrator.RunListener;
import com.portkit.core.report.FileSystemReportWriter;
import com.portkit.core.report.RunReportGenerator;
import com.portkit.core.task.BoundedRetryPolicy;
import com.portkit.core.task.CancellationToken;
import com.portkit.core.task.RetryPolicy;
import com.portkit.core.task.TaskServices;
import com.portkit.core.validation.ProcessValidationRunner;
import com.portkit.core.validation.ValidationRunner;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Command to start or resume a porting run.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration and symbol facts</li>
 *   <li>Build the symbol graph, collapsing dependency cycles</li>
 *   <li>Reconcile checkpoints from earlier runs</li>
 *   <li>Port ready units concurrently, in dependency order</li>
 *   <li>Print and write the run summary</li>
 * </ol>
 *
 * <p>Ctrl-C stops dispatching new units; units in flight finish their current
 * step and are checkpointed. Running the command again resumes.
 *
 * <p><b>Exit codes:</b> 0 when every unit is verified, 2 when some units
 * failed, are blocked or pending, 1 on fatal errors.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * portkit run
 * portkit run -c tools/portkit.yaml --concurrency 4 --max-attempts 5
 * }</pre>
 */
@Command(
    name = "run",
    description = "Start or resume porting all units",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_INCOMPLETE = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: portkit.yaml)"
    )
    private Path configPath = Paths.get("portkit.yaml");

    @Option(
        names = {"--concurrency"},
        description = "Maximum units in flight (overrides config)"
    )
    private Integer concurrency;

    @Option(
        names = {"--max-attempts"},
        description = "Generation attempts per unit (overrides config)"
    )
    private Integer maxAttempts;

    @Option(
        names = {"--no-report"},
        description = "Don't write run-summary files"
    )
    private boolean noReport;

    @Override
    public Integer call() {
        try {
            // Step 0: Load configuration
            ProjectContext context = ProjectContext.load(configPath);
            PortkitConfig config = context.config();
            ProjectLayout layout = context.layout();
            System.out.println("Porting project: " + config.project().name() + " (" + layout.projectDir() + ")");
            System.out.println();

            // Step 1: Build the symbol graph
            SymbolGraph graph = context.buildGraph();
            System.out.println("✓ Built symbol graph: " + graph.symbols().size() + " symbols, "
                + graph.size() + " units (" + graph.cycles().size() + " cycle groups)");

            // Step 2: Wire collaborators
            ArtifactWorkspace workspace = new ArtifactWorkspace(layout.artifactsDir());
            GenerationCollaborator collaborator = GenerationCollaborators.create(config.generation(), layout.projectDir());
            ValidationRunner runner = new ProcessValidationRunner(config.validation(), workspace, layout.projectDir(),
                unit -> !graph.dependents(unit.id()).isEmpty());
            TaskServices services = new TaskServices(collaborator, runner, workspace, retryPolicy(config),
                config.generation().requireDifferentialTestForDataTypes());
            CheckpointStore store = new FileCheckpointStore(layout.checkpointDir());
            int limit = concurrency != null ? Math.max(1, concurrency) : config.orchestrator().concurrency();

            // Step 3: Run with Ctrl-C mapped to cancellation
            CancellationToken token = new CancellationToken();
            CancelOnShutdown shutdown = new CancelOnShutdown(token,
                Duration.ofSeconds(config.orchestrator().shutdownGraceSeconds()));
            Thread hook = new Thread(shutdown, "portkit-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            RunSummary summary;
            try {
                summary = new Orchestrator(services, token)
                    .addListener(new ConsoleProgress())
                    .run(graph, store, limit);
            } finally {
                shutdown.runFinished();
                removeHook(hook);
            }

            // Step 4: Report
            printSummary(summary);
            if (!noReport) {
                RunReportGenerator generator = new RunReportGenerator();
                new FileSystemReportWriter().write(generator.generate(summary, config.project().name()), layout.reportDir());
                System.out.println("✓ Wrote run summary to: " + layout.reportDir());
            }

            return summary.allVerified() ? 0 : EXIT_INCOMPLETE;

        } catch (MalformedGraphException e) {
            log.error("Symbol facts are malformed: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Run failed", e);
            System.err.println("✗ Run failed: " + e.getMessage());
            return 1;
        }
    }

    private RetryPolicy retryPolicy(PortkitConfig config) {
        BoundedRetryPolicy policy = BoundedRetryPolicy.from(config.retry());
        if (maxAttempts == null) {
            return policy;
        }
        return new BoundedRetryPolicy(Math.max(1, maxAttempts), policy.infrastructureRetries(),
            policy.initialBackoff(), policy.maxBackoff());
    }

    private void printSummary(RunSummary summary) {
        System.out.println();
        if (summary.interrupted()) {
            System.out.println("⚠ Run interrupted; run again to resume");
        }
        new RunReportGenerator().consoleLines(summary).forEach(System.out::println);
        System.out.println();
        System.out.println(summary.allVerified() ? "✓ All units verified" : "✗ Porting incomplete");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down; shutdown hook stays registered");
        }
    }

    /**
     * Prints one line per dispatched and completed unit.
     */
    private static final class ConsoleProgress implements RunListener {

        @Override
        public void unitDispatched(ProcessingUnit unit) {
            System.out.println("  → " + unit.id() + (unit.isCycle() ? " " + unit.memberNames() : ""));
        }

        @Override
        public void unitCompleted(UnitOutcome outcome) {
            String marker = outcome.status() == OutcomeStatus.VERIFIED ? "✓" : "✗";
            System.out.println("  " + marker + " " + outcome.unitId() + " " + outcome.status()
                + " after " + outcome.attempts() + " attempt(s)");
        }
    }
}
