package com.portkit.core.report;

import java.util.Objects;

/**
 * A generated report file.
 *
 * @param relativePath path relative to the report directory (e.g., "run-summary.md")
 * @param content file content
 * @param contentType content type
 */
public record ReportFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public ReportFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
