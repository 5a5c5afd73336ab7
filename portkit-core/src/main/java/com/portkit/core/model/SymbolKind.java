package com.portkit.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of source symbols that can be ported.
 */
public enum SymbolKind {
    /** Function with a body; ported together with a differential test */
    FUNCTION,

    /** Struct or union definition */
    STRUCT,

    /** Enumeration */
    ENUM,

    /** Type alias */
    TYPEDEF,

    /** Object-like macro or constant */
    MACRO_CONSTANT;

    /**
     * Resolves a kind from the label used in parsed-facts documents.
     *
     * <p>Accepts the enum name in any case, with {@code -} or {@code _} separators,
     * plus the analyzer aliases {@code const} and {@code define}.
     *
     * @param label label from the facts input
     * @return matching kind, or empty if the label is unknown
     */
    public static Optional<SymbolKind> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "FUNCTION" -> Optional.of(FUNCTION);
            case "STRUCT", "UNION" -> Optional.of(STRUCT);
            case "ENUM" -> Optional.of(ENUM);
            case "TYPEDEF" -> Optional.of(TYPEDEF);
            case "MACRO_CONSTANT", "MACRO", "CONST", "DEFINE" -> Optional.of(MACRO_CONSTANT);
            default -> Optional.empty();
        };
    }

    /**
     * Returns the label written to reports and collaborator requests.
     *
     * @return lower-case, hyphenated label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
