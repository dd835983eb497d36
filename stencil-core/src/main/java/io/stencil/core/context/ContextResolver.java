package io.stencil.core.context;

import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Sequence;
import java.util.Optional;

/// Resolves dotted paths such as `user.address.street` or `items.0.name` against a context.
///
/// Each segment selects a key of a {@link Mapping} or a zero-based index of a
/// {@link Sequence}. A missing key, an index out of range, a non-numeric index, or any attempt
/// to descend into a scalar yields an empty result.
///
/// ### Contracts
/// - **Postcondition**: never throws for any path or context
/// - **Invariant**: the context is only read
public final class ContextResolver {

    private ContextResolver() {}

    /// Resolves a path against the context.
    ///
    /// @param context the value to start from, may be null
    /// @param path dot-separated path, may be null
    /// @return the value found, or empty if any segment cannot be followed
    public static Optional<ContextValue> resolve(ContextValue context, String path) {
        if (context == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }

        ContextValue current = context;
        int from = 0;
        while (true) {
            int dot = path.indexOf('.', from);
            String segment = dot < 0 ? path.substring(from) : path.substring(from, dot);
            Optional<ContextValue> next = step(current, segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
            if (dot < 0) {
                return Optional.of(current);
            }
            from = dot + 1;
        }
    }

    /// Returns whether the path resolves against the context.
    public static boolean exists(ContextValue context, String path) {
        return resolve(context, path).isPresent();
    }

    private static Optional<ContextValue> step(ContextValue current, String segment) {
        if (segment.isEmpty()) {
            return Optional.empty();
        }
        if (current instanceof Mapping mapping) {
            return mapping.get(segment);
        }
        if (current instanceof Sequence sequence) {
            int index = parseIndex(segment);
            if (index < 0 || index >= sequence.size()) {
                return Optional.empty();
            }
            return Optional.of(sequence.get(index));
        }
        return Optional.empty();
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }
}
