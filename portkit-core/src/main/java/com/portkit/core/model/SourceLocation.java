package com.portkit.core.model;

import java.util.Objects;

/**
 * Position of a symbol definition in the original source tree.
 *
 * @param file source file path, relative to the source project
 * @param line one-based line number, or 0 when unknown
 */
public record SourceLocation(
    String file,
    int line
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        Objects.requireNonNull(file, "file must not be null");
        if (line < 0) {
            line = 0;
        }
    }

    /**
     * Location used when the analyzer did not report one.
     *
     * @return unknown location
     */
    public static SourceLocation unknown() {
        return new SourceLocation("<unknown>", 0);
    }

    @Override
    public String toString() {
        return line > 0 ? file + ":" + line : file;
    }
}
