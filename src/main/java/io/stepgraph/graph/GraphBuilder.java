package io.stepgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects nodes, edges and reducers, then validates them into a {@link Graph}.
 *
 * <pre>{@code
 * Graph graph = new GraphBuilder("counter")
 *         .addNode("intake", intake)
 *         .addNode("finalize", finalize)
 *         .addEdge(Graph.START, "intake")
 *         .addEdge("intake", "finalize")
 *         .addEdge("finalize", Graph.END)
 *         .compile();
 * }</pre>
 *
 * <p>Problems are collected rather than reported one at a time; {@link #compile()} throws a
 * single {@link CompileException} listing all of them.
 */
public final class GraphBuilder {
    private final String name;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final Map<String, Reducer> reducers = new LinkedHashMap<>();
    private final List<String> problems = new ArrayList<>();
    private int maxSteps;

    public GraphBuilder(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("graph name must not be blank");
        }
        this.name = name.trim();
    }

    public GraphBuilder addNode(String stepName, Node node) {
        if (stepName == null || stepName.isBlank()) {
            problems.add("node name must not be blank");
            return this;
        }
        if (Graph.isReserved(stepName)) {
            problems.add("node name '" + stepName + "' is reserved");
            return this;
        }
        if (node == null) {
            problems.add("node '" + stepName + "' has no implementation");
            return this;
        }
        if (nodes.putIfAbsent(stepName, node) != null) {
            problems.add("node '" + stepName + "' is defined twice");
        }
        return this;
    }

    public GraphBuilder addEdge(String source, String target) {
        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            problems.add("edge needs a source and a target");
            return this;
        }
        return putEdge(Edge.fixed(source, target));
    }

    /**
     * Routes out of {@code source} through {@code router}. {@code possibleTargets} is optional;
     * when given, every target is checked at compile time and used for the reachability check.
     */
    public GraphBuilder addConditionalEdges(String source, Router router, String... possibleTargets) {
        if (source == null || source.isBlank()) {
            problems.add("conditional edge needs a source");
            return this;
        }
        if (router == null) {
            problems.add("conditional edge from '" + source + "' has no router");
            return this;
        }
        return putEdge(Edge.conditional(source, router, new LinkedHashSet<>(Arrays.asList(possibleTargets))));
    }

    public GraphBuilder reducer(String field, Reducer reducer) {
        if (field == null || field.isBlank() || reducer == null) {
            problems.add("reducer needs a field and a policy");
            return this;
        }
        reducers.put(field, reducer);
        return this;
    }

    /**
     * Fails a run once it would execute more than {@code limit} steps in total. 0 disables the guard.
     */
    public GraphBuilder maxSteps(int limit) {
        if (limit < 0) {
            problems.add("maxSteps must be >= 0");
            return this;
        }
        this.maxSteps = limit;
        return this;
    }

    public Graph compile() {
        List<String> found = new ArrayList<>(problems);
        validateEdges(found);
        if (!edges.containsKey(Graph.START)) {
            found.add("no edge leaves " + Graph.START);
        }
        for (String node : nodes.keySet()) {
            if (!edges.containsKey(node)) {
                found.add("node '" + node + "' has no outgoing edge");
            }
        }
        if (found.isEmpty()) {
            for (String node : unreachable()) {
                found.add("node '" + node + "' is not reachable from " + Graph.START);
            }
        }
        if (!found.isEmpty()) {
            throw new CompileException(name, found);
        }
        return new Graph(name, nodes, edges, reducers, maxSteps);
    }

    private GraphBuilder putEdge(Edge edge) {
        if (edges.putIfAbsent(edge.source(), edge) != null) {
            problems.add("more than one edge leaves '" + edge.source() + "'");
        }
        return this;
    }

    private void validateEdges(List<String> found) {
        for (Edge edge : edges.values()) {
            String source = edge.source();
            if (Graph.END.equals(source)) {
                found.add("no edge may leave " + Graph.END);
            } else if (!Graph.START.equals(source) && !nodes.containsKey(source)) {
                found.add("edge source '" + source + "' is not a node");
            }
            for (String target : edge.declaredTargets()) {
                if (Graph.START.equals(target)) {
                    found.add("edge from '" + source + "' targets " + Graph.START);
                } else if (!Graph.END.equals(target) && !nodes.containsKey(target)) {
                    found.add("edge from '" + source + "' targets unknown node '" + target + "'");
                }
            }
        }
    }

    private Set<String> unreachable() {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(Graph.START);
        while (!queue.isEmpty()) {
            Edge edge = edges.get(queue.poll());
            if (edge == null) {
                continue;
            }
            Set<String> targets = edge.isConditional() && edge.declaredTargets().isEmpty()
                    ? nodes.keySet()
                    : edge.declaredTargets();
            for (String target : targets) {
                if (nodes.containsKey(target) && seen.add(target)) {
                    queue.add(target);
                }
            }
        }
        Set<String> out = new LinkedHashSet<>(nodes.keySet());
        out.removeAll(seen);
        return out;
    }
}
