package io.stencil.core.error;

/// Receives diagnostics as they are produced.
///
/// The renderer and module phases report through this interface so they do not need to know
/// which invocation, or which content unit, they are working for.
@FunctionalInterface
public interface ErrorSink {

    /// Discards everything. Useful for evaluating templates where diagnostics are not wanted.
    ErrorSink NONE = record -> {};

    /// Accepts one diagnostic.
    ///
    /// @param record the diagnostic, not null
    void add(ErrorRecord record);

    /// Returns a sink that stamps every record with the given unit id before forwarding it.
    ///
    /// @param unitId content unit id, may be null
    /// @return a forwarding sink, never null
    default ErrorSink forUnit(String unitId) {
        return record -> add(record.withContentUnitId(unitId));
    }
}
