package io.stepgraph.graph;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

final class GraphBuilderTest {
    private static final Node NOOP = state -> StateUpdate.empty();

    @Test
    void compilesLinearGraph() {
        Graph graph = new GraphBuilder("linear")
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addEdge(Graph.START, "a")
                .addEdge("a", "b")
                .addEdge("b", Graph.END)
                .maxSteps(10)
                .compile();

        Assertions.assertEquals("linear", graph.name());
        Assertions.assertEquals(Set.of("a", "b"), graph.nodeNames());
        Assertions.assertEquals(10, graph.maxSteps());
        Assertions.assertEquals(Reducer.OVERWRITE, graph.reducerFor("anything"));
        RunState empty = new RunState("r", io.stepgraph.util.Jsons.newObject());
        Assertions.assertEquals("a", graph.route(Graph.START, empty));
        Assertions.assertEquals(Graph.END, graph.route("b", empty));
    }

    @Test
    void reportsEveryProblemAtOnce() {
        CompileException e = Assertions.assertThrows(CompileException.class, () -> new GraphBuilder("broken")
                .addNode("a", NOOP)
                .addNode("a", NOOP)
                .addNode(Graph.END, NOOP)
                .addNode("b", NOOP)
                .addEdge("a", "missing")
                .addEdge("ghost", "a")
                .compile());

        Assertions.assertTrue(e.problems().contains("node 'a' is defined twice"), e.problems().toString());
        Assertions.assertTrue(e.problems().contains("node name '" + Graph.END + "' is reserved"));
        Assertions.assertTrue(e.problems().contains("edge from 'a' targets unknown node 'missing'"));
        Assertions.assertTrue(e.problems().contains("edge source 'ghost' is not a node"));
        Assertions.assertTrue(e.problems().contains("no edge leaves " + Graph.START));
        Assertions.assertTrue(e.problems().contains("node 'b' has no outgoing edge"));
        Assertions.assertTrue(e.getMessage().startsWith("Graph 'broken' is invalid"));
    }

    @Test
    void rejectsSecondEdgeFromSameSource() {
        CompileException e = Assertions.assertThrows(CompileException.class, () -> new GraphBuilder("fork")
                .addNode("a", NOOP)
                .addEdge(Graph.START, "a")
                .addEdge("a", Graph.END)
                .addConditionalEdges("a", state -> Graph.END)
                .compile());
        Assertions.assertEquals(1, e.problems().size());
        Assertions.assertEquals("more than one edge leaves 'a'", e.problems().get(0));
    }

    @Test
    void rejectsEdgesIntoStartAndOutOfEnd() {
        CompileException e = Assertions.assertThrows(CompileException.class, () -> new GraphBuilder("loopback")
                .addNode("a", NOOP)
                .addEdge(Graph.START, "a")
                .addEdge("a", Graph.START)
                .addEdge(Graph.END, "a")
                .compile());
        Assertions.assertTrue(e.problems().contains("edge from 'a' targets " + Graph.START));
        Assertions.assertTrue(e.problems().contains("no edge may leave " + Graph.END));
    }

    @Test
    void rejectsUnreachableNodes() {
        CompileException e = Assertions.assertThrows(CompileException.class, () -> new GraphBuilder("island")
                .addNode("a", NOOP)
                .addNode("island", NOOP)
                .addEdge(Graph.START, "a")
                .addEdge("a", Graph.END)
                .addEdge("island", Graph.END)
                .compile());
        Assertions.assertEquals(java.util.List.of("node 'island' is not reachable from " + Graph.START), e.problems());
    }

    @Test
    void conditionalEdgeWithoutDeclaredTargetsCountsAsReachingEveryNode() {
        Graph graph = new GraphBuilder("open-router")
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addConditionalEdges(Graph.START, state -> state.flag("useB", false) ? "b" : "a")
                .addEdge("a", Graph.END)
                .addEdge("b", Graph.END)
                .compile();
        Assertions.assertEquals(Set.of("a", "b"), graph.nodeNames());
    }

    @Test
    void validatesDeclaredConditionalTargets() {
        CompileException e = Assertions.assertThrows(CompileException.class, () -> new GraphBuilder("targets")
                .addNode("a", NOOP)
                .addEdge(Graph.START, "a")
                .addConditionalEdges("a", state -> "a", "a", "nowhere", Graph.END)
                .compile());
        Assertions.assertEquals(java.util.List.of("edge from 'a' targets unknown node 'nowhere'"), e.problems());
    }

    @Test
    void rejectsMissingPiecesAndBadLimits() {
        CompileException e = Assertions.assertThrows(CompileException.class, () -> new GraphBuilder("holes")
                .addNode("a", null)
                .addNode(" ", NOOP)
                .addEdge(Graph.START, null)
                .addConditionalEdges("a", null)
                .reducer("messages", null)
                .maxSteps(-1)
                .compile());
        Assertions.assertTrue(e.problems().contains("node 'a' has no implementation"));
        Assertions.assertTrue(e.problems().contains("node name must not be blank"));
        Assertions.assertTrue(e.problems().contains("edge needs a source and a target"));
        Assertions.assertTrue(e.problems().contains("conditional edge from 'a' has no router"));
        Assertions.assertTrue(e.problems().contains("reducer needs a field and a policy"));
        Assertions.assertTrue(e.problems().contains("maxSteps must be >= 0"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new GraphBuilder(""));
    }

    @Test
    void routeWithoutEdgeFails() {
        Graph graph = new GraphBuilder("single")
                .addNode("a", NOOP)
                .addEdge(Graph.START, "a")
                .addEdge("a", Graph.END)
                .compile();
        Assertions.assertThrows(IllegalStateException.class,
                () -> graph.route("zzz", new RunState("r", io.stepgraph.util.Jsons.newObject())));
    }
}
