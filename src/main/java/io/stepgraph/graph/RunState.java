package io.stepgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a run's state handed to steps and routers.
 */
public final class RunState {
    private final String runId;
    private final ObjectNode values;

    public RunState(String runId, ObjectNode values) {
        this.runId = runId;
        this.values = values.deepCopy();
    }

    public String runId() {
        return runId;
    }

    public boolean has(String field) {
        return values.has(field);
    }

    /**
     * A copy of the field's value, or a missing node.
     */
    public JsonNode get(String field) {
        JsonNode node = values.get(field);
        return node == null ? MissingNode.getInstance() : node.deepCopy();
    }

    public String text(String field, String fallback) {
        JsonNode node = values.get(field);
        return node == null || node.isNull() ? fallback : node.asText();
    }

    public long number(String field, long fallback) {
        JsonNode node = values.get(field);
        return node == null || !node.isNumber() ? fallback : node.asLong();
    }

    public boolean flag(String field, boolean fallback) {
        JsonNode node = values.get(field);
        return node == null || !node.isBoolean() ? fallback : node.asBoolean();
    }

    public int size(String field) {
        JsonNode node = values.get(field);
        return node == null || !node.isContainerNode() ? 0 : node.size();
    }

    public List<String> fieldNames() {
        List<String> out = new ArrayList<>();
        values.fieldNames().forEachRemaining(out::add);
        return out;
    }

    public ObjectNode toJson() {
        return values.deepCopy();
    }

    @Override
    public String toString() {
        return "RunState{runId=" + runId + ", values=" + values + "}";
    }
}
