package io.stencil.core.context;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable hierarchical data a template is rendered against.
///
/// ### Permitted Subtypes
/// - {@link Scalar} - string, number, boolean or null
/// - {@link Sequence} - ordered list of values
/// - {@link Mapping} - string-keyed values, optionally layered over an outer scope
///
/// Values are never mutated once built. Loop scoping creates new {@link Mapping} layers with
/// {@link Mapping#shadow(Map)} instead of writing into the caller's root, so one snapshot can
/// be shared by concurrently rendered content units.
///
/// @see ContextValues for conversion from plain Java objects
/// @see ContextResolver for path lookup
public sealed interface ContextValue
        permits ContextValue.Scalar, ContextValue.Sequence, ContextValue.Mapping {

    /// Returns whether this value counts as "empty" for truthiness and paragraph removal.
    ///
    /// Null scalars, empty strings, empty sequences and empty mappings are empty.
    boolean isEmpty();

    /// A leaf value.
    ///
    /// @param value a {@link String}, {@link Number}, {@link Boolean} or null
    record Scalar(Object value) implements ContextValue {

        public static final Scalar NULL = new Scalar(null);
        public static final Scalar TRUE = new Scalar(Boolean.TRUE);
        public static final Scalar FALSE = new Scalar(Boolean.FALSE);

        public Scalar {
            if (value != null
                    && !(value instanceof String)
                    && !(value instanceof Number)
                    && !(value instanceof Boolean)) {
                throw new IllegalArgumentException(
                        "Unsupported scalar type: " + value.getClass().getName());
            }
        }

        public static Scalar of(String value) {
            return value == null ? NULL : new Scalar(value);
        }

        public static Scalar of(Number value) {
            return value == null ? NULL : new Scalar(value);
        }

        public static Scalar of(boolean value) {
            return value ? TRUE : FALSE;
        }

        public boolean isNull() {
            return value == null;
        }

        public boolean isString() {
            return value instanceof String;
        }

        public boolean isNumber() {
            return value instanceof Number;
        }

        public boolean isBoolean() {
            return value instanceof Boolean;
        }

        @Override
        public boolean isEmpty() {
            return value == null || (value instanceof String s && s.isEmpty());
        }

        /// Returns the display form of this scalar.
        ///
        /// Integral numbers print without a fraction (`3.0` prints as `3`), other numbers in
        /// plain decimal notation; null prints as `null`.
        ///
        /// @return string form, never null
        public String asText() {
            if (value == null) {
                return "null";
            }
            if (value instanceof Number number) {
                return formatNumber(number);
            }
            return value.toString();
        }

        /// Returns the numeric value of this scalar, parsing numeric strings.
        ///
        /// @return the number as a double, or empty when the value is not numeric
        public Optional<Double> asDouble() {
            if (value instanceof Number number) {
                return Optional.of(number.doubleValue());
            }
            if (value instanceof String s) {
                return ContextValues.parseNumber(s);
            }
            return Optional.empty();
        }

        private static String formatNumber(Number number) {
            if (number instanceof Integer
                    || number instanceof Long
                    || number instanceof Short
                    || number instanceof Byte
                    || number instanceof BigInteger) {
                return number.toString();
            }
            if (number instanceof BigDecimal decimal) {
                return decimal.stripTrailingZeros().toPlainString();
            }
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Double.toString(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
    }

    /// An ordered list of values.
    ///
    /// @param elements the elements, copied into an immutable list
    record Sequence(List<ContextValue> elements) implements ContextValue {

        public Sequence {
            elements = List.copyOf(elements);
        }

        public static Sequence of(ContextValue... elements) {
            return new Sequence(List.of(elements));
        }

        public int size() {
            return elements.size();
        }

        public ContextValue get(int index) {
            return elements.get(index);
        }

        @Override
        public boolean isEmpty() {
            return elements.isEmpty();
        }
    }

    /// String-keyed values.
    ///
    /// A mapping may be layered over a parent: lookups check its own entries first and fall
    /// back to the parent. {@link #asMap()} presents the merged view.
    final class Mapping implements ContextValue {

        private static final Mapping EMPTY = new Mapping(Map.of(), null);

        private final Map<String, ContextValue> entries;
        private final Mapping parent;

        private Mapping(Map<String, ContextValue> entries, Mapping parent) {
            this.entries = entries;
            this.parent = parent;
        }

        /// Creates a mapping from the given entries.
        ///
        /// @param entries keys and values, not null; null values are not allowed
        /// @return a new mapping, never null
        public static Mapping of(Map<String, ContextValue> entries) {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            Map<String, ContextValue> copy = new LinkedHashMap<>();
            entries.forEach(
                    (key, value) ->
                            copy.put(
                                    Objects.requireNonNull(key, "key must not be null"),
                                    Objects.requireNonNull(value, "value of " + key)));
            return new Mapping(Collections.unmodifiableMap(copy), null);
        }

        public static Mapping empty() {
            return EMPTY;
        }

        /// Returns a new mapping whose bindings hide same-named keys of this one.
        ///
        /// This mapping is not modified; the result only references it.
        ///
        /// @param bindings values visible in the new scope, not null
        /// @return the layered mapping, never null
        public Mapping shadow(Map<String, ContextValue> bindings) {
            Mapping layer = of(bindings);
            return new Mapping(layer.entries, this);
        }

        public Optional<ContextValue> get(String key) {
            ContextValue value = entries.get(key);
            if (value != null) {
                return Optional.of(value);
            }
            return parent != null ? parent.get(key) : Optional.empty();
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key) || (parent != null && parent.containsKey(key));
        }

        /// Returns all visible keys.
        ///
        /// @return unmodifiable key set, never null
        public Set<String> keys() {
            return asMap().keySet();
        }

        /// Returns the merged view of this mapping and its parents.
        ///
        /// @return unmodifiable map, never null
        public Map<String, ContextValue> asMap() {
            if (parent == null) {
                return entries;
            }
            Map<String, ContextValue> merged = new LinkedHashMap<>(parent.asMap());
            merged.putAll(entries);
            return Collections.unmodifiableMap(merged);
        }

        public int size() {
            return asMap().size();
        }

        @Override
        public boolean isEmpty() {
            return entries.isEmpty() && (parent == null || parent.isEmpty());
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Mapping mapping && asMap().equals(mapping.asMap());
        }

        @Override
        public int hashCode() {
            return asMap().hashCode();
        }

        @Override
        public String toString() {
            return "Mapping" + asMap();
        }
    }
}
