package com.portkit.core.facts;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One symbol record as reported by the source analyzer.
 *
 * <p>Values are kept as reported; {@code SymbolGraph.build} validates them.
 *
 * @param name symbol name
 * @param kind kind label ({@code function}, {@code struct}, {@code enum}, {@code typedef}, {@code macro-constant})
 * @param file source file of the definition
 * @param line line of the definition
 * @param isStatic file-local visibility hint
 * @param isCycle analyzer's cycle hint; advisory only
 * @param dependencies names the definition requires, in declaration order
 * @param definition optional source text of the definition
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SymbolFact(
    @JsonProperty("name") String name,
    @JsonProperty("kind") String kind,
    @JsonProperty("file") String file,
    @JsonProperty("line") int line,
    @JsonProperty("static") @JsonAlias({"isStatic", "is_static"}) boolean isStatic,
    @JsonProperty("cycle") @JsonAlias({"isCycle", "is_cycle"}) boolean isCycle,
    @JsonProperty("dependencies") List<String> dependencies,
    @JsonProperty("definition") String definition
) {
    /**
     * Compact constructor with defaults.
     */
    public SymbolFact {
        dependencies = dependencies == null ? List.of() : dependencies.stream().toList();
    }

    /**
     * Shorthand for a fact without location, definition or hints.
     *
     * @param name symbol name
     * @param kind kind label
     * @param dependencies dependency names
     * @return a new fact
     */
    public static SymbolFact of(String name, String kind, String... dependencies) {
        return new SymbolFact(name, kind, null, 0, false, false, List.of(dependencies), null);
    }
}
