package io.stencil.core.render;

import io.stencil.core.context.ContextValue;

/// Turns a resolved context value into the text substituted for a placeholder.
///
/// The renderer never passes null scalars here; those go through the configured null getter.
///
/// @see DefaultValueFormatter for the built-in implementation
@FunctionalInterface
public interface ValueFormatter {

    /// Formats a value for output.
    ///
    /// @param value resolved value, not null
    /// @return text to substitute, never null
    String format(ContextValue value);
}
