package io.stepgraph.graph;

import java.util.List;

public final class CompileException extends RuntimeException {
    private final List<String> problems;

    public CompileException(String graphName, List<String> problems) {
        super("Graph '" + graphName + "' is invalid: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
