package work.lcod.synth.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Function;

/**
 * Directed graph of ordering constraints. An edge {@code (from, to)} means {@code from} comes
 * after {@code to}. Nodes remember the order they were first seen; that order breaks ties.
 */
public final class DependencyGraph<T> {
    private final Map<T, Integer> declarationOrder = new LinkedHashMap<>();
    private final Map<T, Set<T>> dependencies = new HashMap<>();
    private final Function<T, String> describer;

    public DependencyGraph() {
        this(String::valueOf);
    }

    public DependencyGraph(Function<T, String> describer) {
        this.describer = Objects.requireNonNull(describer, "describer");
    }

    public void addNode(T node) {
        Objects.requireNonNull(node, "node");
        if (!declarationOrder.containsKey(node)) {
            declarationOrder.put(node, declarationOrder.size());
            dependencies.put(node, new LinkedHashSet<>());
        }
    }

    /**
     * Adds {@code from -> to}. Adding an existing edge is a no-op.
     */
    public void addDependency(T from, T to) {
        addNode(from);
        addNode(to);
        dependencies.get(from).add(to);
    }

    public boolean contains(T node) {
        return declarationOrder.containsKey(node);
    }

    public List<T> nodes() {
        return List.copyOf(declarationOrder.keySet());
    }

    public Set<T> dependenciesOf(T node) {
        var deps = dependencies.get(node);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    public int edgeCount() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Depth-first search with a recursion stack; throws on the first cycle found.
     */
    public void assertAcyclic() {
        var done = new HashSet<T>();
        var onStack = new LinkedHashSet<T>();
        for (T node : declarationOrder.keySet()) {
            visit(node, done, onStack);
        }
    }

    private void visit(T node, Set<T> done, LinkedHashSet<T> onStack) {
        if (done.contains(node)) {
            return;
        }
        if (!onStack.add(node)) {
            throw new CyclicDependencyException(describeCycle(onStack, node));
        }
        for (T dependency : sortedByDeclaration(dependencies.get(node))) {
            visit(dependency, done, onStack);
        }
        onStack.remove(node);
        done.add(node);
    }

    private List<String> describeCycle(LinkedHashSet<T> onStack, T repeated) {
        var cycle = new ArrayList<String>();
        boolean inCycle = false;
        for (T node : onStack) {
            if (node.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(describer.apply(node));
            }
        }
        cycle.add(describer.apply(repeated));
        return cycle;
    }

    /**
     * Dependencies before dependents; among nodes that are ready at the same time the earliest
     * declared goes first.
     */
    public List<T> topologicalOrder() {
        assertAcyclic();
        var remaining = new HashMap<T, Integer>();
        var dependents = new HashMap<T, List<T>>();
        for (var entry : dependencies.entrySet()) {
            remaining.put(entry.getKey(), entry.getValue().size());
            for (T dependency : entry.getValue()) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(entry.getKey());
            }
        }
        var ready = new PriorityQueue<T>((left, right) -> Integer.compare(declarationOrder.get(left), declarationOrder.get(right)));
        for (T node : declarationOrder.keySet()) {
            if (remaining.get(node) == 0) {
                ready.add(node);
            }
        }
        var order = new ArrayList<T>(declarationOrder.size());
        while (!ready.isEmpty()) {
            T next = ready.poll();
            order.add(next);
            for (T dependent : dependents.getOrDefault(next, List.of())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    private List<T> sortedByDeclaration(Set<T> nodes) {
        var sorted = new ArrayList<>(nodes);
        sorted.sort((left, right) -> Integer.compare(declarationOrder.get(left), declarationOrder.get(right)));
        return sorted;
    }
}
