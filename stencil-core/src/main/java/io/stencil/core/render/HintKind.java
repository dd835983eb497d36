package io.stencil.core.render;

/// Structural changes the renderer can ask the format layer to make.
public enum HintKind {
    /// Remove the markup block (for example the paragraph) that encloses the hint position.
    REMOVE_ENCLOSING_BLOCK
}
