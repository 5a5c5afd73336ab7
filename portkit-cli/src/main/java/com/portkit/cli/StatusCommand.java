package com.portkit.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.portkit.core.checkpoint.FileCheckpointStore;
import com.portkit.core.model.CheckpointRecord;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to show checkpointed unit status.
 *
 * <p>Without arguments, lists every stored record. With unit ids, prints the
 * full record of each, including the last diagnostic.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * portkit status
 * portkit status cycle-NodeA ZopfliGetLengthSymbol
 * }</pre>
 */
@Command(
    name = "status",
    description = "Show checkpointed unit status",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: portkit.yaml)"
    )
    private Path configPath = Paths.get("portkit.yaml");

    @Parameters(
        arity = "0..*",
        description = "Unit ids to show in detail"
    )
    private List<String> unitIds = new ArrayList<>();

    @Override
    public Integer call() {
        try {
            ProjectContext context = ProjectContext.load(configPath);
            FileCheckpointStore store = new FileCheckpointStore(context.layout().checkpointDir());
            Map<String, CheckpointRecord> records = store.load();

            if (unitIds.isEmpty()) {
                if (records.isEmpty()) {
                    System.out.println("No checkpoints found in: " + store.directory());
                    return 0;
                }
                System.out.println("Checkpointed units (" + records.size() + "):");
                System.out.println();
                records.values().forEach(record -> System.out.printf("  %-11s %3d  %s%n",
                    record.status(), record.attemptCount(), record.unitId()));
                return 0;
            }

            int missing = 0;
            for (String unitId : unitIds) {
                CheckpointRecord record = records.get(unitId);
                if (record == null) {
                    System.err.println("✗ No checkpoint for unit: " + unitId);
                    missing++;
                    continue;
                }
                printDetail(record);
            }
            return missing == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Status failed", e);
            System.err.println("✗ Status failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printDetail(CheckpointRecord record) {
        System.out.println(record.unitId());
        System.out.println("  Symbols:   " + String.join(", ", record.symbols()));
        System.out.println("  Status:    " + record.status());
        System.out.println("  Attempts:  " + record.attemptCount());
        System.out.println("  Updated:   " + record.timestamp());
        record.fingerprints().forEach((role, hash) ->
            System.out.println("  " + role.label() + ": " + hash.substring(0, Math.min(16, hash.length()))));
        if (record.lastError() != null) {
            System.out.println("  Last error (" + record.lastError().kind() + "):");
            record.lastError().message().lines().forEach(line -> System.out.println("    " + line));
        }
        System.out.println();
    }
}
