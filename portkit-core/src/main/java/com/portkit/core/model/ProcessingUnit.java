package com.portkit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The atomic granule the orchestrator schedules: a single symbol, or every
 * member of a collapsed dependency cycle.
 *
 * @param id unit identifier (symbol name, or {@code cycle-<first member>})
 * @param members member symbols in source order
 * @param dependencyUnitIds ids of the units this unit depends on, ascending by their source order
 * @param externalDependencies union of the members' external dependencies
 * @param sourceOrder lowest source order among the members
 */
public record ProcessingUnit(
    String id,
    List<Symbol> members,
    List<String> dependencyUnitIds,
    List<String> externalDependencies,
    int sourceOrder
) {
    /**
     * Compact constructor with validation.
     */
    public ProcessingUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(members, "members must not be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A processing unit needs at least one member: " + id);
        }
        members = List.copyOf(members);
        dependencyUnitIds = dependencyUnitIds == null ? List.of() : List.copyOf(dependencyUnitIds);
        externalDependencies = externalDependencies == null ? List.of() : List.copyOf(externalDependencies);
    }

    /**
     * Returns whether this unit is a collapsed cycle group.
     *
     * @return true if the unit has more than one member
     */
    public boolean isCycle() {
        return members.size() > 1;
    }

    /**
     * Returns the member names in source order.
     *
     * @return member symbol names
     */
    public List<String> memberNames() {
        return members.stream().map(Symbol::name).toList();
    }

    /**
     * Returns whether any member has behavior that a differential test can exercise.
     *
     * @return true if a member is a function
     */
    public boolean hasBehavior() {
        return members.stream().anyMatch(symbol -> symbol.kind() == SymbolKind.FUNCTION);
    }
}
