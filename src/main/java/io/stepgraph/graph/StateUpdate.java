package io.stepgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.stepgraph.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partial state returned by a step. Entries keep the order they were added in, and one
 * field may appear more than once; each entry goes through the field's {@link Reducer}.
 */
public final class StateUpdate {
    private final List<FieldUpdate> entries = new ArrayList<>();

    public static StateUpdate empty() {
        return new StateUpdate();
    }

    public static StateUpdate of(String field, Object value) {
        return new StateUpdate().put(field, value);
    }

    public StateUpdate put(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        JsonNode node = value == null
                ? NullNode.getInstance()
                : value instanceof JsonNode json ? json.deepCopy() : Jsons.mapper().valueToTree(value);
        entries.add(new FieldUpdate(field, node));
        return this;
    }

    public List<FieldUpdate> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public record FieldUpdate(String field, JsonNode value) {
    }
}
