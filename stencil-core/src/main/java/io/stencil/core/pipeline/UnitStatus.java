package io.stencil.core.pipeline;

/// Outcome of one content unit within a render invocation.
public enum UnitStatus {
    /// Went through every step; the text is the rendered output.
    RENDERED,
    /// Failed to parse in lenient mode; the text is the unmodified raw input.
    PASSED_THROUGH,
    /// Stopped by a fatal error in strict mode; no text.
    ABORTED,
    /// Abandoned after cancellation or timeout; no text.
    CANCELLED;

    public boolean hasOutput() {
        return this == RENDERED || this == PASSED_THROUGH;
    }
}
