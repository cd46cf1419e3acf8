package io.stepgraph.graph;

/**
 * Picks the next step from the state a step left behind. May return {@link Graph#END}.
 */
@FunctionalInterface
public interface Router {
    String route(RunState state);
}
