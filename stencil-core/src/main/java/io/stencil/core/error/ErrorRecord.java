package io.stencil.core.error;

import java.util.Objects;
import java.util.Optional;

/// A single diagnostic accumulated during a render invocation.
///
/// @param kind classification of the failure, not null
/// @param message human-readable description, not null
/// @param contentUnitId id of the unit being processed, may be null for invocation-level records
/// @param position character offset in the unit's template text, null if not applicable
/// @param severity whether processing recovered, not null
public record ErrorRecord(
        ErrorKind kind,
        String message,
        String contentUnitId,
        Integer position,
        Severity severity) {

    public ErrorRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    /// Creates a recoverable record.
    public static ErrorRecord recoverable(
            ErrorKind kind, String message, String contentUnitId, Integer position) {
        return new ErrorRecord(kind, message, contentUnitId, position, Severity.RECOVERABLE);
    }

    /// Creates a fatal record.
    public static ErrorRecord fatal(
            ErrorKind kind, String message, String contentUnitId, Integer position) {
        return new ErrorRecord(kind, message, contentUnitId, position, Severity.FATAL);
    }

    /// Returns the position as an optional.
    ///
    /// @return the character offset, or empty when the record is not tied to a location
    public Optional<Integer> location() {
        return Optional.ofNullable(position);
    }

    /// Returns a copy of this record attributed to the given content unit.
    ///
    /// @param unitId the content unit id, may be null
    /// @return a new record, never null
    public ErrorRecord withContentUnitId(String unitId) {
        return new ErrorRecord(kind, message, unitId, position, severity);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
