package com.portkit.core.graph;

import java.util.List;

/**
 * Raised when parsed facts cannot form a valid symbol graph.
 *
 * <p>Fatal: the run aborts before any unit is dispatched. All problems found
 * in one pass are reported together.
 */
public class MalformedGraphException extends RuntimeException {

    private final List<String> problems;

    public MalformedGraphException(List<String> problems) {
        super(format(problems));
        this.problems = List.copyOf(problems);
    }

    public MalformedGraphException(List<String> problems, Throwable cause) {
        super(format(problems), cause);
        this.problems = List.copyOf(problems);
    }

    /**
     * @return every problem found, in input order
     */
    public List<String> getProblems() {
        return problems;
    }

    private static String format(List<String> problems) {
        if (problems.size() == 1) {
            return "Malformed symbol graph: " + problems.get(0);
        }
        StringBuilder message = new StringBuilder("Malformed symbol graph (")
            .append(problems.size())
            .append(" problems):");
        problems.forEach(problem -> message.append("\n  - ").append(problem));
        return message.toString();
    }
}
