package com.portkit.core.graph;

import com.portkit.core.facts.FactsDocument;
import com.portkit.core.facts.SymbolFact;
import com.portkit.core.model.ProcessingUnit;
import com.portkit.core.model.SourceLocation;
import com.portkit.core.model.Symbol;
import com.portkit.core.model.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable dependency graph over the symbols of one project.
 *
 * <p>Construction validates the facts, finds strongly-connected components with
 * Tarjan's algorithm and collapses each component of more than one symbol into a
 * single {@link ProcessingUnit}. The resulting unit graph is acyclic and is
 * ordered once with Kahn's algorithm, always releasing the ready unit that
 * appears first in the original source.
 *
 * <p>Cycle rules:
 * <ul>
 *   <li>Cycles sharing a member form one component and therefore one unit.</li>
 *   <li>A symbol depending on itself stays a singleton; the self edge is ignored.</li>
 *   <li>External names never take part in cycle detection.</li>
 *   <li>The analyzer's {@code cycle} hint is advisory; computed cycles win.</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SymbolGraph graph = SymbolGraph.build(FactsLoader.load(Path.of("facts.json")));
 * for (ProcessingUnit unit : graph.order()) {
 *     System.out.println(unit.id() + " <- " + unit.dependencyUnitIds());
 * }
 * }</pre>
 */
public final class SymbolGraph {

    private static final Logger log = LoggerFactory.getLogger(SymbolGraph.class);

    /** Prefix of unit ids for collapsed cycles; never valid in a C identifier. */
    public static final String CYCLE_PREFIX = "cycle-";

    private final Map<String, Symbol> symbols;
    private final Map<String, ProcessingUnit> units;
    private final Map<String, String> unitIdBySymbol;
    private final List<ProcessingUnit> order;
    private final Map<String, Integer> topologicalIndex;
    private final Map<String, List<String>> dependents;

    private SymbolGraph(Map<String, Symbol> symbols,
                        Map<String, ProcessingUnit> units,
                        Map<String, String> unitIdBySymbol,
                        List<ProcessingUnit> order,
                        Map<String, List<String>> dependents) {
        this.symbols = symbols;
        this.units = units;
        this.unitIdBySymbol = unitIdBySymbol;
        this.order = List.copyOf(order);
        this.topologicalIndex = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            topologicalIndex.put(order.get(i).id(), i);
        }
        this.dependents = dependents;
    }

    /**
     * Builds the graph from a parsed-facts document.
     *
     * @param document analyzer output
     * @return immutable graph
     * @throws MalformedGraphException if the facts are inconsistent
     */
    public static SymbolGraph build(FactsDocument document) {
        return build(document.symbols(), document.external());
    }

    /**
     * Builds the graph from symbol facts.
     *
     * @param facts symbol records in original source order
     * @param external names that may be depended on without being defined
     * @return immutable graph
     * @throws MalformedGraphException if a name is blank or duplicated, a kind is
     *     unknown, or a dependency resolves neither to a symbol nor to an external name
     */
    public static SymbolGraph build(List<SymbolFact> facts, Collection<String> external) {
        Set<String> externalNames = new HashSet<>(external);
        List<String> problems = new ArrayList<>();

        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < facts.size(); i++) {
            String name = facts.get(i).name();
            if (name == null || name.isBlank()) {
                problems.add("Symbol record #" + i + " has no name");
            } else if (indexByName.putIfAbsent(name, i) != null) {
                problems.add("Duplicate symbol '" + name + "' (records #" + indexByName.get(name) + " and #" + i + ")");
            }
        }

        List<Symbol> symbols = new ArrayList<>(facts.size());
        for (int i = 0; i < facts.size(); i++) {
            SymbolFact fact = facts.get(i);
            String name = fact.name() == null || fact.name().isBlank() ? "#" + i : fact.name();

            Optional<SymbolKind> kind = SymbolKind.fromLabel(fact.kind());
            if (kind.isEmpty()) {
                problems.add("Symbol '" + name + "' has unknown kind '" + fact.kind() + "'");
            }

            Set<String> internal = new LinkedHashSet<>();
            Set<String> externalDeps = new LinkedHashSet<>();
            for (String dependency : fact.dependencies()) {
                if (dependency == null || dependency.isBlank()) {
                    problems.add("Symbol '" + name + "' has a blank dependency name");
                } else if (dependency.equals(fact.name())) {
                    log.debug("Ignoring self-dependency of symbol '{}'", name);
                } else if (indexByName.containsKey(dependency)) {
                    internal.add(dependency);
                } else if (externalNames.contains(dependency)) {
                    externalDeps.add(dependency);
                } else {
                    problems.add("Symbol '" + name + "' depends on unresolved name '" + dependency + "'");
                }
            }

            if (problems.isEmpty()) {
                SourceLocation location = fact.file() == null
                    ? SourceLocation.unknown()
                    : new SourceLocation(fact.file(), fact.line());
                symbols.add(new Symbol(name, kind.orElseThrow(), location, List.copyOf(internal),
                    List.copyOf(externalDeps), fact.isStatic(), null, i, fact.definition()));
            }
        }

        if (!problems.isEmpty()) {
            throw new MalformedGraphException(problems);
        }

        List<List<Integer>> components = stronglyConnectedComponents(symbols, indexByName);
        return assemble(symbols, facts, indexByName, components);
    }

    /**
     * Iterative Tarjan SCC over symbol indices, visiting roots and edges in source order.
     */
    private static List<List<Integer>> stronglyConnectedComponents(List<Symbol> symbols,
                                                                  Map<String, Integer> indexByName) {
        int n = symbols.size();
        int[][] adjacency = new int[n][];
        for (int v = 0; v < n; v++) {
            adjacency[v] = symbols.get(v).dependencies().stream().mapToInt(indexByName::get).toArray();
        }

        int[] index = new int[n];
        int[] low = new int[n];
        int[] edgePosition = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            Deque<Integer> callStack = new ArrayDeque<>();
            index[root] = low[root] = counter++;
            stack.push(root);
            onStack[root] = true;
            callStack.push(root);

            while (!callStack.isEmpty()) {
                int v = callStack.peek();
                if (edgePosition[v] < adjacency[v].length) {
                    int w = adjacency[v][edgePosition[v]++];
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        callStack.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                callStack.pop();
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    component.sort(Comparator.naturalOrder());
                    components.add(component);
                }
            }
        }
        return components;
    }

    private static SymbolGraph assemble(List<Symbol> symbols,
                                        List<SymbolFact> facts,
                                        Map<String, Integer> indexByName,
                                        List<List<Integer>> components) {
        Map<String, String> unitIdBySymbol = new HashMap<>();
        Map<String, Symbol> finalSymbols = new LinkedHashMap<>();
        List<String> unitIds = new ArrayList<>();

        for (List<Integer> component : components) {
            Symbol first = symbols.get(component.get(0));
            String unitId = component.size() > 1 ? CYCLE_PREFIX + first.name() : first.name();
            unitIds.add(unitId);
            for (int member : component) {
                Symbol symbol = symbols.get(member);
                unitIdBySymbol.put(symbol.name(), unitId);
                boolean hinted = facts.get(member).isCycle();
                if (hinted != (component.size() > 1)) {
                    log.debug("Cycle hint for '{}' is {} but computed membership is {}",
                        symbol.name(), hinted, component.size() > 1);
                }
            }
        }
        for (Symbol symbol : symbols) {
            String unitId = unitIdBySymbol.get(symbol.name());
            finalSymbols.put(symbol.name(),
                unitId.startsWith(CYCLE_PREFIX) ? symbol.withCycleId(unitId) : symbol);
        }

        Map<String, ProcessingUnit> units = new HashMap<>();
        for (int c = 0; c < components.size(); c++) {
            List<Integer> component = components.get(c);
            String unitId = unitIds.get(c);
            List<Symbol> members = component.stream()
                .map(i -> finalSymbols.get(symbols.get(i).name()))
                .toList();

            Set<String> dependencyUnits = new LinkedHashSet<>();
            Set<String> externals = new LinkedHashSet<>();
            for (Symbol member : members) {
                for (String dependency : member.dependencies()) {
                    String dependencyUnit = unitIdBySymbol.get(dependency);
                    if (!dependencyUnit.equals(unitId)) {
                        dependencyUnits.add(dependencyUnit);
                    }
                }
                externals.addAll(member.externalDependencies());
            }
            units.put(unitId, new ProcessingUnit(unitId, members, List.copyOf(dependencyUnits),
                List.copyOf(externals), component.get(0)));
        }

        // Sort dependency ids by source order now that every unit exists.
        Map<String, ProcessingUnit> sortedUnits = new HashMap<>();
        for (ProcessingUnit unit : units.values()) {
            List<String> sortedDependencies = unit.dependencyUnitIds().stream()
                .sorted(Comparator.comparingInt(id -> units.get(id).sourceOrder()))
                .toList();
            sortedUnits.put(unit.id(), new ProcessingUnit(unit.id(), unit.members(), sortedDependencies,
                unit.externalDependencies(), unit.sourceOrder()));
        }

        Map<String, List<String>> dependents = new HashMap<>();
        sortedUnits.keySet().forEach(id -> dependents.put(id, new ArrayList<>()));
        sortedUnits.values().forEach(unit ->
            unit.dependencyUnitIds().forEach(dependency -> dependents.get(dependency).add(unit.id())));

        List<ProcessingUnit> order = topologicalOrder(sortedUnits, dependents);

        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i).id(), i);
        }
        Map<String, List<String>> sortedDependents = new HashMap<>();
        dependents.forEach((id, list) -> sortedDependents.put(id,
            list.stream().sorted(Comparator.comparingInt(position::get)).toList()));

        long cycles = order.stream().filter(ProcessingUnit::isCycle).count();
        log.info("Built symbol graph: {} symbols, {} processing units ({} cycle groups)",
            finalSymbols.size(), order.size(), cycles);

        return new SymbolGraph(finalSymbols, sortedUnits, unitIdBySymbol, order, sortedDependents);
    }

    /**
     * Kahn's algorithm; among ready units the one earliest in the source goes first.
     */
    private static List<ProcessingUnit> topologicalOrder(Map<String, ProcessingUnit> units,
                                                         Map<String, List<String>> dependents) {
        Map<String, Integer> remaining = new HashMap<>();
        PriorityQueue<ProcessingUnit> ready = new PriorityQueue<>(Comparator.comparingInt(ProcessingUnit::sourceOrder));
        for (ProcessingUnit unit : units.values()) {
            remaining.put(unit.id(), unit.dependencyUnitIds().size());
            if (unit.dependencyUnitIds().isEmpty()) {
                ready.add(unit);
            }
        }

        List<ProcessingUnit> order = new ArrayList<>(units.size());
        while (!ready.isEmpty()) {
            ProcessingUnit unit = ready.poll();
            order.add(unit);
            for (String dependent : dependents.get(unit.id())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(units.get(dependent));
                }
            }
        }

        if (order.size() != units.size()) {
            throw new IllegalStateException("Unit graph still contains a cycle after condensation");
        }
        return order;
    }

    /**
     * Returns processing units in deterministic topological order: every unit
     * appears after all the units it depends on, and ties are broken by
     * ascending original source order.
     *
     * @return units, dependencies first
     */
    public List<ProcessingUnit> order() {
        return order;
    }

    public Optional<ProcessingUnit> unit(String unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    public Optional<ProcessingUnit> unitOf(String symbolName) {
        return Optional.ofNullable(unitIdBySymbol.get(symbolName)).map(units::get);
    }

    public Optional<Symbol> symbol(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @return all symbols in original source order
     */
    public Collection<Symbol> symbols() {
        return symbols.values();
    }

    /**
     * Returns the position of a unit in {@link #order()}.
     *
     * @param unitId processing unit id
     * @return zero-based topological index
     * @throws IllegalArgumentException if the unit is unknown
     */
    public int topologicalIndex(String unitId) {
        Integer position = topologicalIndex.get(unitId);
        if (position == null) {
            throw new IllegalArgumentException("Unknown processing unit: " + unitId);
        }
        return position;
    }

    /**
     * Returns the units that depend directly on the given unit, in topological order.
     *
     * @param unitId processing unit id
     * @return direct dependents
     */
    public List<ProcessingUnit> dependents(String unitId) {
        return dependents.getOrDefault(unitId, List.of()).stream().map(units::get).toList();
    }

    /**
     * Returns every unit that depends on the given unit directly or indirectly,
     * in topological order.
     *
     * @param unitId processing unit id
     * @return transitive dependents, excluding the unit itself
     */
    public List<ProcessingUnit> transitiveDependents(String unitId) {
        TreeSet<Integer> found = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(dependents.getOrDefault(unitId, List.of()));
        while (!pending.isEmpty()) {
            String next = pending.pop();
            if (found.add(topologicalIndex.get(next))) {
                pending.addAll(dependents.get(next));
            }
        }
        return found.stream().map(order::get).toList();
    }

    /**
     * @return collapsed cycle units in topological order
     */
    public List<ProcessingUnit> cycles() {
        return order.stream().filter(ProcessingUnit::isCycle).toList();
    }

    public int size() {
        return order.size();
    }
}
