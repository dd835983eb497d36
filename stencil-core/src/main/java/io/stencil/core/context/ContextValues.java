package io.stencil.core.context;

import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.context.ContextValue.Sequence;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/// Conversions between plain Java objects and {@link ContextValue}s.
///
/// `Map`s become mappings (keys via `String.valueOf`), `Collection`s and arrays become
/// sequences, `String`, `Number` and `Boolean` become scalars, `Character`s and enums become
/// string scalars. Any other object is rejected.
public final class ContextValues {

    private static final Pattern NUMBER =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private ContextValues() {}

    /// Converts a Java object graph into an immutable context value.
    ///
    /// @param value object to convert, may be null
    /// @return the converted value, never null
    /// @throws IllegalArgumentException if the graph contains an unsupported type
    public static ContextValue of(Object value) {
        if (value == null) {
            return Scalar.NULL;
        }
        if (value instanceof ContextValue contextValue) {
            return contextValue;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return new Scalar(value);
        }
        if (value instanceof Character || value instanceof Enum<?>) {
            return Scalar.of(value.toString());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, ContextValue> entries = new LinkedHashMap<>();
            map.forEach((key, item) -> entries.put(String.valueOf(key), of(item)));
            return Mapping.of(entries);
        }
        if (value instanceof Collection<?> collection) {
            List<ContextValue> elements = new ArrayList<>(collection.size());
            for (Object item : collection) {
                elements.add(of(item));
            }
            return new Sequence(elements);
        }
        if (value instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        throw new IllegalArgumentException(
                "Unsupported context value type: " + value.getClass().getName());
    }

    /// Converts a Java map into a context mapping.
    ///
    /// @param map entries to convert, may be null (treated as empty)
    /// @return the converted mapping, never null
    public static Mapping mapping(Map<String, ?> map) {
        if (map == null) {
            return Mapping.empty();
        }
        return (Mapping) of(map);
    }

    /// Converts a context value back into plain Java objects.
    ///
    /// @param value the value, not null
    /// @return a `String`, `Number`, `Boolean`, `List`, `Map` or null
    public static Object toJava(ContextValue value) {
        if (value instanceof Scalar scalar) {
            return scalar.value();
        }
        if (value instanceof Sequence sequence) {
            List<Object> list = new ArrayList<>(sequence.size());
            for (ContextValue element : sequence.elements()) {
                list.add(toJava(element));
            }
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        ((Mapping) value).asMap().forEach((key, item) -> map.put(key, toJava(item)));
        return map;
    }

    /// Parses a decimal number literal such as `18`, `-2.5` or `1e3`.
    ///
    /// @param text candidate literal, may be null
    /// @return the parsed value, or empty if `text` is not a number literal
    public static Optional<Double> parseNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!NUMBER.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(Double.parseDouble(trimmed));
    }
}
