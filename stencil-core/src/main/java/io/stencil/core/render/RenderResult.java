package io.stencil.core.render;

import java.util.List;

/// Output of rendering one syntax tree.
///
/// @param text rendered text, not null
/// @param hints structural hints in document order, immutable, not null
public record RenderResult(String text, List<StructuralHint> hints) {

    public RenderResult {
        hints = List.copyOf(hints);
    }
}
