package io.stencil.core.error;

/// Classifies a diagnostic produced during a render invocation.
///
/// ### Kinds
/// - `SYNTAX` - unmatched or malformed block tags; fatal for the affected content unit
/// - `RESOLUTION` - a placeholder path was not found in the context
/// - `TYPE` - a loop target is not a sequence, or condition operands cannot be compared
/// - `MODULE` - a module phase threw, or a module could not process its tag data
/// - `CANCELLED` - a content unit was abandoned before completion
public enum ErrorKind {
    SYNTAX,
    RESOLUTION,
    TYPE,
    MODULE,
    CANCELLED
}
