package io.stencil.core.error;

/// Severity of an {@link ErrorRecord}.
///
/// `RECOVERABLE` records were handled in place with a substitute value. `FATAL` records
/// aborted the content unit (and possibly the whole invocation) they belong to.
public enum Severity {
    RECOVERABLE,
    FATAL
}
