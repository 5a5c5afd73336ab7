package com.portkit.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.portkit.core.model.OutcomeStatus;
import com.portkit.core.model.RunSummary;
import com.portkit.core.model.UnitOutcome;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Renders a {@link RunSummary} as Markdown, JSON and console text.
 *
 * <p>Outcomes appear in topological order. Failed and blocked units are listed
 * again in a failure section with their last diagnostic.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<ReportFile> files = new RunReportGenerator().generate(summary, "zopfli");
 * new FileSystemReportWriter().write(files, Path.of(".portkit/reports"));
 * }</pre>
 */
public class RunReportGenerator {

    static final String MARKDOWN_FILE = "run-summary.md";
    static final String JSON_FILE = "run-summary.json";

    private static final String NEWLINE = "\n";
    private static final String PIPE = "|";
    private static final int MAX_CELL_LENGTH = 160;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Renders every report format.
     *
     * @param summary run summary
     * @param projectName project name for headings
     * @return report files
     */
    public List<ReportFile> generate(RunSummary summary, String projectName) {
        return List.of(
            new ReportFile(MARKDOWN_FILE, markdown(summary, projectName), "text/markdown"),
            new ReportFile(JSON_FILE, json(summary, projectName), "application/json")
        );
    }

    /**
     * @param summary run summary
     * @param projectName project name for the heading
     * @return Markdown report
     */
    public String markdown(RunSummary summary, String projectName) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(projectName).append(" - Porting Run Summary").append(NEWLINE).append(NEWLINE);
        if (summary.interrupted()) {
            md.append("> Run was interrupted; pending units resume on the next run.").append(NEWLINE).append(NEWLINE);
        }

        md.append("## Totals").append(NEWLINE).append(NEWLINE);
        md.append("| Status | Units |").append(NEWLINE);
        md.append("|--------|-------|").append(NEWLINE);
        md.append("| Total | ").append(summary.outcomes().size()).append(" |").append(NEWLINE);
        for (Map.Entry<OutcomeStatus, Integer> count : summary.counts().entrySet()) {
            md.append("| ").append(count.getKey()).append(" | ").append(count.getValue()).append(" |").append(NEWLINE);
        }
        md.append(NEWLINE);

        md.append("## Units").append(NEWLINE).append(NEWLINE);
        md.append("| Unit | Symbols | Status | Attempts |").append(NEWLINE);
        md.append("|------|---------|--------|----------|").append(NEWLINE);
        for (UnitOutcome outcome : summary.outcomes()) {
            md.append("| `").append(escape(outcome.unitId())).append("` ")
                .append(PIPE).append(' ').append(escape(String.join(", ", outcome.symbols()))).append(' ')
                .append(PIPE).append(' ').append(outcome.status()).append(outcome.resumed() ? " (resumed)" : "").append(' ')
                .append(PIPE).append(' ').append(outcome.attempts()).append(" |").append(NEWLINE);
        }

        List<UnitOutcome> failures = summary.failures();
        if (!failures.isEmpty()) {
            md.append(NEWLINE).append("## Failures").append(NEWLINE).append(NEWLINE);
            for (UnitOutcome failure : failures) {
                md.append("### ").append(failure.unitId()).append(" (").append(failure.status()).append(')')
                    .append(NEWLINE).append(NEWLINE);
                String diagnostic = failure.lastError() == null ? "No diagnostic recorded." : failure.lastError().message();
                md.append("```").append(NEWLINE).append(diagnostic.strip()).append(NEWLINE).append("```")
                    .append(NEWLINE).append(NEWLINE);
            }
        }

        if (!summary.dispatchOrder().isEmpty()) {
            md.append(NEWLINE).append("## Dispatch Order").append(NEWLINE).append(NEWLINE);
            for (int i = 0; i < summary.dispatchOrder().size(); i++) {
                md.append(i + 1).append(". `").append(summary.dispatchOrder().get(i)).append('`').append(NEWLINE);
            }
        }
        return md.toString();
    }

    /**
     * @param summary run summary
     * @param projectName project name
     * @return JSON report
     */
    public String json(RunSummary summary, String projectName) {
        ObjectNode root = mapper.createObjectNode();
        root.put("project", projectName);
        root.put("interrupted", summary.interrupted());
        root.set("counts", mapper.valueToTree(summary.counts()));
        root.set("outcomes", mapper.valueToTree(summary.outcomes()));
        root.set("failures", mapper.valueToTree(summary.failures().stream().map(UnitOutcome::unitId).toList()));
        root.set("dispatchOrder", mapper.valueToTree(summary.dispatchOrder()));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render run summary as JSON", e);
        }
    }

    /**
     * Renders a short plain-text summary for the terminal.
     *
     * @param summary run summary
     * @return console lines
     */
    public List<String> consoleLines(RunSummary summary) {
        Map<OutcomeStatus, Integer> counts = summary.counts();
        String totals = String.format("%d units: %d verified, %d failed, %d blocked, %d pending",
            summary.outcomes().size(),
            counts.get(OutcomeStatus.VERIFIED),
            counts.get(OutcomeStatus.FAILED),
            counts.get(OutcomeStatus.BLOCKED),
            counts.get(OutcomeStatus.PENDING));

        List<String> failureLines = summary.failures().stream()
            .map(o -> "  " + o.status() + " " + o.unitId()
                + (o.lastError() == null ? "" : ": " + truncate(o.lastError().headline())))
            .toList();

        return Stream.concat(Stream.of(totals), failureLines.stream()).toList();
    }

    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private String truncate(String text) {
        return text.length() <= MAX_CELL_LENGTH ? text : text.substring(0, MAX_CELL_LENGTH) + "...";
    }
}
