package io.stepgraph.runtime;

import io.stepgraph.graph.Graph;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class GraphRegistry {
    private final Map<String, Graph> graphs = new ConcurrentHashMap<>();

    public GraphRegistry register(Graph graph) {
        if (graphs.putIfAbsent(graph.name(), graph) != null) {
            throw new IllegalArgumentException("graph '" + graph.name() + "' is already registered");
        }
        return this;
    }

    public Optional<Graph> find(String graphName) {
        return graphName == null ? Optional.empty() : Optional.ofNullable(graphs.get(graphName));
    }

    public Collection<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(graphs.keySet()));
    }
}
