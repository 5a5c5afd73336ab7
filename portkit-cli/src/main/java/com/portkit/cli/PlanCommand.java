package com.portkit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.portkit.core.graph.MalformedGraphException;
import com.portkit.core.graph.SymbolGraph;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.Symbol;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate symbol facts and print the processing order.
 *
 * <p>Nothing is generated and no checkpoint is touched. Cycle groups are
 * printed with their members.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * portkit plan
 * portkit plan --dependencies
 * }</pre>
 */
@Command(
    name = "plan",
    description = "Validate symbol facts and print the processing order",
    mixinStandardHelpOptions = true
)
public class PlanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: portkit.yaml)"
    )
    private Path configPath = Paths.get("portkit.yaml");

    @Option(
        names = {"-d", "--dependencies"},
        description = "Also print each unit's dependency units"
    )
    private boolean showDependencies;

    @Override
    public Integer call() {
        try {
            SymbolGraph graph = ProjectContext.load(configPath).buildGraph();
            List<ProcessingUnit> order = graph.order();

            System.out.println("Processing order (" + order.size() + " units):");
            System.out.println();
            for (int i = 0; i < order.size(); i++) {
                ProcessingUnit unit = order.get(i);
                System.out.printf("%4d. %s%n", i + 1, describe(unit));
                if (unit.isCycle()) {
                    for (Symbol member : unit.members()) {
                        System.out.printf("        - %s (%s, %s)%n", member.name(), member.kind().label(), member.location());
                    }
                }
                if (showDependencies && !unit.dependencyUnitIds().isEmpty()) {
                    System.out.println("        depends on: " + String.join(", ", unit.dependencyUnitIds()));
                }
            }

            System.out.println();
            System.out.println("✓ Symbol graph is valid: " + graph.symbols().size() + " symbols, "
                + graph.cycles().size() + " cycle groups");
            return 0;

        } catch (MalformedGraphException e) {
            log.error("Symbol facts are malformed: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Plan failed", e);
            System.err.println("✗ Plan failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(ProcessingUnit unit) {
        if (unit.isCycle()) {
            return unit.id() + " [cycle of " + unit.members().size() + "]";
        }
        Symbol symbol = unit.members().get(0);
        return symbol.name() + " (" + symbol.kind().label() + (symbol.isStatic() ? ", static" : "") + ")";
    }
}
