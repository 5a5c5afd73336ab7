package com.portkit.core.model;

import java.util.Objects;

/**
 * Last error recorded for a unit.
 *
 * @param kind error classification
 * @param message diagnostic text (compiler output, test diff, or cause)
 */
public record ErrorSummary(
    ErrorKind kind,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ErrorSummary {
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = "";
        }
    }

    /**
     * Returns the first line of the message, for one-line listings.
     *
     * @return headline of the diagnostic
     */
    public String headline() {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
