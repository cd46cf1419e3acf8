package io.stepgraph.graph;

import java.util.Set;

/**
 * Transition out of {@code source}: either a fixed target or a {@link Router}.
 *
 * <p>{@code declaredTargets} lists what a router may return. It is optional and only used to
 * validate the graph at compile time.
 */
public final class Edge {
    private final String source;
    private final String target;
    private final Router router;
    private final Set<String> declaredTargets;

    private Edge(String source, String target, Router router, Set<String> declaredTargets) {
        this.source = source;
        this.target = target;
        this.router = router;
        this.declaredTargets = declaredTargets;
    }

    public static Edge fixed(String source, String target) {
        return new Edge(source, target, null, Set.of(target));
    }

    public static Edge conditional(String source, Router router, Set<String> declaredTargets) {
        return new Edge(source, null, router, Set.copyOf(declaredTargets));
    }

    public String source() {
        return source;
    }

    public boolean isConditional() {
        return router != null;
    }

    public Set<String> declaredTargets() {
        return declaredTargets;
    }

    /**
     * Next step name for {@code state}. May be null when a router returns null.
     */
    public String resolve(RunState state) {
        return router == null ? target : router.route(state);
    }

    @Override
    public String toString() {
        return router == null
                ? source + " -> " + target
                : source + " -> ?" + (declaredTargets.isEmpty() ? "" : declaredTargets);
    }
}
