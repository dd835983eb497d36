package io.stencil.core.pipeline;

/// How far a fatal error reaches in strict mode.
///
/// Syntax errors in strict mode always abort the invocation.
public enum FailureScope {
    /// Only the failing unit is abandoned; the other units still render.
    UNIT,
    /// The whole invocation is abandoned and {@link io.stencil.core.exception.RenderAbortedException}
    /// is raised with the partial report.
    INVOCATION
}
