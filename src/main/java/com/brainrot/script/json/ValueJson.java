package com.brainrot.script.json;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.brainrot.script.core.ArrayStorage;
import com.brainrot.script.core.Value;

/** JSON view of runtime values, used to dump the global variables of a finished run. */
public final class ValueJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        if (v == null) return NODES.nullNode();
        switch (v.type) {
            case SHORT: return NODES.numberNode(v.asShort());
            case INT: return NODES.numberNode(v.asInt());
            case FLOAT: return NODES.numberNode(v.asFloat());
            case DOUBLE: return NODES.numberNode(v.asDouble());
            case BOOL: return NODES.booleanNode(v.asBool());
            case CHAR: return NODES.textNode(String.valueOf((char) v.asChar()));
            case STRING: return NODES.textNode(v.asString());
            default: return arrayToJson(v.asArray());
        }
    }

    /** Nested arrays, one level per dimension, in row-major order. */
    private static ArrayNode arrayToJson(ArrayStorage storage) {
        int[] dims = storage.dimensions();
        int[] cursor = {0};
        return (ArrayNode) fill(storage, dims, 0, cursor);
    }

    private static JsonNode fill(ArrayStorage storage, int[] dims, int axis, int[] cursor) {
        ArrayNode out = NODES.arrayNode(dims[axis]);
        for (int i = 0; i < dims[axis]; i++) {
            if (axis == dims.length - 1) {
                out.add(toJson(storage.getAt(cursor[0]++)));
            } else {
                out.add(fill(storage, dims, axis + 1, cursor));
            }
        }
        return out;
    }

    public static ObjectNode toJson(Map<String, Value> variables) {
        ObjectNode out = NODES.objectNode();
        for (Map.Entry<String, Value> e : variables.entrySet()) {
            out.set(e.getKey(), toJson(e.getValue()));
        }
        return out;
    }

    public static String toPrettyString(ObjectMapper mapper, Map<String, Value> variables) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(variables));
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalStateException("Failed to render variables as JSON", e);
        }
    }
}
