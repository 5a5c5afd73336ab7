package com.portkit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A unit of translation: one named definition from the source project.
 *
 * @param name unique name within the project
 * @param kind symbol kind
 * @param location definition site
 * @param dependencies names of symbols this definition requires, in declaration order
 * @param externalDependencies dependency names satisfied by the declared external set
 * @param isStatic whether the symbol has file-local visibility in the source
 * @param cycleId identifier shared by all members of a dependency cycle, or null
 * @param sourceOrder zero-based position in the parsed facts input
 * @param definition source text of the definition, or null if not supplied
 */
public record Symbol(
    String name,
    SymbolKind kind,
    SourceLocation location,
    List<String> dependencies,
    List<String> externalDependencies,
    boolean isStatic,
    String cycleId,
    int sourceOrder,
    String definition
) {
    /**
     * Compact constructor with validation.
     */
    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (location == null) {
            location = SourceLocation.unknown();
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        externalDependencies = externalDependencies == null ? List.of() : List.copyOf(externalDependencies);
    }

    /**
     * Returns a copy of this symbol assigned to the given cycle.
     *
     * @param id cycle identifier
     * @return symbol with {@code cycleId} set
     */
    public Symbol withCycleId(String id) {
        return new Symbol(name, kind, location, dependencies, externalDependencies, isStatic, id, sourceOrder, definition);
    }
}
