package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.context.ContextValue.Sequence;
import java.io.IOException;
import java.io.Serial;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/// Writes {@link ContextValue}s as plain JSON: mappings as objects, sequences as arrays,
/// scalars as strings, numbers, booleans or `null`.
///
/// Layered mappings are written flattened, with inner bindings shadowing outer ones.
///
/// @implNote Package-private. Registered by {@link StencilJacksonModule}.
/// @see ContextValueDeserializer for the inverse operation
class ContextValueSerializer extends StdSerializer<ContextValue> {

    @Serial private static final long serialVersionUID = 6172009923450281745L;

    ContextValueSerializer() {
        super(ContextValue.class);
    }

    @Override
    public void serialize(ContextValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof Scalar scalar) {
            writeScalar(scalar, gen);
        } else if (value instanceof Sequence sequence) {
            gen.writeStartArray();
            for (ContextValue element : sequence.elements()) {
                serialize(element, gen, provider);
            }
            gen.writeEndArray();
        } else if (value instanceof Mapping mapping) {
            gen.writeStartObject();
            for (Map.Entry<String, ContextValue> entry : mapping.asMap().entrySet()) {
                gen.writeFieldName(entry.getKey());
                serialize(entry.getValue(), gen, provider);
            }
            gen.writeEndObject();
        } else {
            throw new IOException("Unknown context value type: " + value.getClass().getSimpleName());
        }
    }

    private static void writeScalar(Scalar scalar, JsonGenerator gen) throws IOException {
        Object raw = scalar.value();
        if (raw == null) {
            gen.writeNull();
        } else if (raw instanceof String s) {
            gen.writeString(s);
        } else if (raw instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (raw instanceof BigDecimal d) {
            gen.writeNumber(d);
        } else if (raw instanceof BigInteger i) {
            gen.writeNumber(i);
        } else if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            gen.writeNumber(((Number) raw).intValue());
        } else if (raw instanceof Long l) {
            gen.writeNumber(l);
        } else {
            gen.writeNumber(((Number) raw).doubleValue());
        }
    }
}
