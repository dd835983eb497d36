package io.stencil.core.render;

import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.context.ContextValue.Sequence;
import java.util.Iterator;
import java.util.Map;

/// Formats scalars by their display form and structured values as compact JSON.
///
/// Keeps `stencil-core` free of a JSON library. `stencil-serialization` provides a
/// Jackson-backed alternative.
public final class DefaultValueFormatter implements ValueFormatter {

    public static final DefaultValueFormatter INSTANCE = new DefaultValueFormatter();

    @Override
    public String format(ContextValue value) {
        if (value instanceof Scalar scalar) {
            return scalar.asText();
        }
        StringBuilder out = new StringBuilder();
        writeJson(value, out);
        return out.toString();
    }

    private void writeJson(ContextValue value, StringBuilder out) {
        if (value instanceof Scalar scalar) {
            if (scalar.isString()) {
                writeString((String) scalar.value(), out);
            } else {
                out.append(scalar.asText());
            }
        } else if (value instanceof Sequence sequence) {
            out.append('[');
            for (int i = 0; i < sequence.size(); i++) {
                if (i > 0) {
                    out.append(',');
                }
                writeJson(sequence.get(i), out);
            }
            out.append(']');
        } else {
            out.append('{');
            Iterator<Map.Entry<String, ContextValue>> entries =
                    ((Mapping) value).asMap().entrySet().iterator();
            while (entries.hasNext()) {
                Map.Entry<String, ContextValue> entry = entries.next();
                writeString(entry.getKey(), out);
                out.append(':');
                writeJson(entry.getValue(), out);
                if (entries.hasNext()) {
                    out.append(',');
                }
            }
            out.append('}');
        }
    }

    private static void writeString(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
