package io.stepgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Merge policy for one state field.
 */
public enum Reducer {
    /** The update replaces the current value. */
    OVERWRITE {
        @Override
        public JsonNode reduce(JsonNode current, JsonNode update) {
            return update.deepCopy();
        }
    },
    /** Array elements of the update (or the update itself) are appended in order. */
    APPEND {
        @Override
        public JsonNode reduce(JsonNode current, JsonNode update) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            if (current != null && !current.isMissingNode() && !current.isNull()) {
                if (current.isArray()) {
                    out.addAll((ArrayNode) current.deepCopy());
                } else {
                    out.add(current.deepCopy());
                }
            }
            if (update.isArray()) {
                for (JsonNode element : update) {
                    out.add(element.deepCopy());
                }
            } else {
                out.add(update.deepCopy());
            }
            return out;
        }
    },
    /** Shallow object merge; keys of the update win. */
    MERGE {
        @Override
        public JsonNode reduce(JsonNode current, JsonNode update) {
            if (!update.isObject()) {
                throw new IllegalArgumentException("MERGE expects an object update but got " + update.getNodeType());
            }
            ObjectNode out = current != null && current.isObject()
                    ? ((ObjectNode) current).deepCopy()
                    : JsonNodeFactory.instance.objectNode();
            update.fields().forEachRemaining(e -> out.set(e.getKey(), e.getValue().deepCopy()));
            return out;
        }
    };

    /**
     * @param current the field's current value; null or missing when the field is absent
     * @param update  the value a step returned for the field, never null
     */
    public abstract JsonNode reduce(JsonNode current, JsonNode update);
}
