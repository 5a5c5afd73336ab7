package com.portkit.core.facts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parsed-facts document produced by the source analyzer.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * external: [size_t, FILE]
 * symbols:
 *   - name: ZopfliGetLengthSymbol
 *     kind: function
 *     file: src/zopfli/symbols.h
 *     line: 42
 *     dependencies: []
 * }</pre>
 *
 * @param external names resolved outside the project (standard library, system headers)
 * @param symbols symbol records in original source order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FactsDocument(
    @JsonProperty("external") List<String> external,
    @JsonProperty("symbols") List<SymbolFact> symbols
) {
    /**
     * Compact constructor with defaults.
     */
    public FactsDocument {
        external = external == null ? List.of() : List.copyOf(external);
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
