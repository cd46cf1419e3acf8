package io.stepgraph.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled, immutable graph. Holds no per-run state and is safe to share across threads.
 */
public final class Graph {
    public static final String START = "__start__";
    public static final String END = "__end__";

    private final String name;
    private final Map<String, Node> nodes;
    private final Map<String, Edge> edges;
    private final Map<String, Reducer> reducers;
    private final int maxSteps;

    Graph(String name, Map<String, Node> nodes, Map<String, Edge> edges, Map<String, Reducer> reducers, int maxSteps) {
        this.name = name;
        this.nodes = Map.copyOf(nodes);
        this.edges = Map.copyOf(edges);
        this.reducers = Map.copyOf(reducers);
        this.maxSteps = maxSteps;
    }

    public static boolean isReserved(String stepName) {
        return START.equals(stepName) || END.equals(stepName);
    }

    public String name() {
        return name;
    }

    public Set<String> nodeNames() {
        return nodes.keySet();
    }

    public boolean hasNode(String stepName) {
        return stepName != null && nodes.containsKey(stepName);
    }

    public Optional<Node> node(String stepName) {
        return Optional.ofNullable(stepName == null ? null : nodes.get(stepName));
    }

    public Reducer reducerFor(String field) {
        return reducers.getOrDefault(field, Reducer.OVERWRITE);
    }

    /**
     * 0 means no limit.
     */
    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Resolves the edge leaving {@code source}. The result is not validated; it may be null,
     * {@link #END} or a name that is not a node.
     */
    public String route(String source, RunState state) {
        Edge edge = edges.get(source);
        if (edge == null) {
            throw new IllegalStateException("No edge leaves " + source + " in graph " + name);
        }
        return edge.resolve(state);
    }

    /**
     * Merges {@code update} into {@code state} in place, entry by entry in the order returned.
     */
    public void reduce(ObjectNode state, StateUpdate update) {
        for (StateUpdate.FieldUpdate entry : update.entries()) {
            Reducer reducer = reducerFor(entry.field());
            state.set(entry.field(), reducer.reduce(state.get(entry.field()), entry.value()));
        }
    }

    @Override
    public String toString() {
        return "Graph{name=" + name + ", nodes=" + nodes.keySet() + ", edges=" + edges.values() + "}";
    }
}
