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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to force units back to unstarted.
 *
 * <p>The unit's attempt count and last error are cleared, so the next run
 * ports it from scratch. Units that depend on it keep their own status.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * portkit reset ZopfliGetLengthSymbol
 * }</pre>
 */
@Command(
    name = "reset",
    description = "Force units back to unstarted",
    mixinStandardHelpOptions = true
)
public class ResetCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResetCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: portkit.yaml)"
    )
    private Path configPath = Paths.get("portkit.yaml");

    @Parameters(
        arity = "1..*",
        description = "Unit ids to reset"
    )
    private List<String> unitIds;

    @Override
    public Integer call() {
        try {
            ProjectContext context = ProjectContext.load(configPath);
            FileCheckpointStore store = new FileCheckpointStore(context.layout().checkpointDir());

            int missing = 0;
            for (String unitId : unitIds) {
                Optional<CheckpointRecord> reset = store.reset(unitId);
                if (reset.isPresent()) {
                    System.out.println("✓ Reset " + unitId);
                } else {
                    System.err.println("✗ No checkpoint for unit: " + unitId);
                    missing++;
                }
            }
            return missing == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Reset failed", e);
            System.err.println("✗ Reset failed: " + e.getMessage());
            return 1;
        }
    }
}
