package io.stepgraph.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One run to drive: which graph, which run id, and the state to start from when the run has
 * no checkpoint yet. {@code initialState} is ignored when the run is resumed.
 */
public record WorkItem(String graphName, String runId, ObjectNode initialState) {
    public WorkItem {
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("graphName must not be blank");
        }
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
    }
}
