package io.stepgraph.sample;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.graph.Graph;
import io.stepgraph.graph.GraphBuilder;
import io.stepgraph.graph.Reducer;
import io.stepgraph.graph.RunState;
import io.stepgraph.graph.StateUpdate;
import io.stepgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-step demo graph: {@code input} validates, {@code process} loops until
 * {@code step_count} reaches {@value #MAX_PROCESS_STEPS}, {@code output} summarizes.
 * {@code messages} accumulates through {@link Reducer#APPEND}.
 */
public final class ExampleGraph {
    private static final Logger log = LoggerFactory.getLogger(ExampleGraph.class);

    public static final String NAME = "example";
    public static final int MAX_PROCESS_STEPS = 3;

    private ExampleGraph() {
    }

    public static Graph create() {
        return new GraphBuilder(NAME)
                .addNode("input", ExampleGraph::input)
                .addNode("process", ExampleGraph::process)
                .addNode("output", ExampleGraph::output)
                .reducer("messages", Reducer.APPEND)
                .addEdge(Graph.START, "input")
                .addConditionalEdges("input", ExampleGraph::shouldContinue, "process", "output")
                .addConditionalEdges("process", ExampleGraph::shouldContinue, "process", "output")
                .addEdge("output", Graph.END)
                .compile();
    }

    public static ObjectNode initialState() {
        ObjectNode state = Jsons.newObject();
        state.set("messages", Jsons.mapper().valueToTree(List.of(message("user", "Hello, start the workflow!"))));
        state.put("step_count", 0);
        state.put("should_continue", true);
        return state;
    }

    static StateUpdate input(RunState state) {
        log.info("Input step for run {}", state.runId());
        return new StateUpdate()
                .put("messages", List.of(message("system", "Input received and validated")))
                .put("step_count", state.number("step_count", 0) + 1)
                .put("should_continue", true);
    }

    static StateUpdate process(RunState state) {
        long step = state.number("step_count", 0) + 1;
        log.info("Process step {} for run {}", step, state.runId());
        return new StateUpdate()
                .put("messages", List.of(message("assistant", "Processing complete (step " + step + ")")))
                .put("step_count", step)
                .put("should_continue", step < MAX_PROCESS_STEPS);
    }

    static StateUpdate output(RunState state) {
        long steps = state.number("step_count", 0);
        log.info("Output step for run {} after {} steps", state.runId(), steps);
        return StateUpdate.of("messages", List.of(message("assistant", "Workflow complete after " + steps + " steps")));
    }

    static String shouldContinue(RunState state) {
        return state.flag("should_continue", false) ? "process" : "output";
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
