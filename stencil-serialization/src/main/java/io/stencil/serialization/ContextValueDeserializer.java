package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.context.ContextValue.Sequence;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads any JSON document into a {@link ContextValue}.
///
/// Objects become {@link Mapping}s (key order preserved), arrays {@link Sequence}s, and
/// everything else a {@link Scalar}. Integral numbers stay integral, so `3` renders as `3`
/// rather than `3.0`.
///
/// @implNote Package-private. Registered by {@link StencilJacksonModule}.
/// @see ContextValueSerializer for the inverse operation
class ContextValueDeserializer extends StdDeserializer<ContextValue> {

    @Serial private static final long serialVersionUID = -3301792615583328104L;

    ContextValueDeserializer() {
        super(ContextValue.class);
    }

    @Override
    public ContextValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.readValueAsTree();
        return toContextValue(root);
    }

    /// Returns {@link Scalar#NULL} for a JSON `null` instead of a Java null.
    @Override
    public ContextValue getNullValue(DeserializationContext ctxt) {
        return Scalar.NULL;
    }

    static ContextValue toContextValue(JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Scalar.NULL;
        }
        if (node.isObject()) {
            Map<String, ContextValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toContextValue(field.getValue()));
            }
            return Mapping.of(entries);
        }
        if (node.isArray()) {
            List<ContextValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(toContextValue(element));
            }
            return new Sequence(elements);
        }
        if (node.isTextual()) {
            return Scalar.of(node.textValue());
        }
        if (node.isBoolean()) {
            return Scalar.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return Scalar.of(node.numberValue());
        }
        throw new IOException("Unsupported JSON node for context value: " + node.getNodeType());
    }
}
