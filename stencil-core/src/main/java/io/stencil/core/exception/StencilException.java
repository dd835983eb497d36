package io.stencil.core.exception;

import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.Severity;
import java.io.Serial;

/// Base class for failures raised while tokenizing, building or rendering a template.
///
/// Carries the {@link ErrorKind} and the template position so that the pipeline can turn any
/// failure into an {@link ErrorRecord} without inspecting the concrete type.
public class StencilException extends RuntimeException {
    @Serial private static final long serialVersionUID = 4127553905168830162L;

    private final ErrorKind kind;
    private final Integer position;

    public StencilException(ErrorKind kind, String message, Integer position) {
        super(message);
        this.kind = kind;
        this.position = position;
    }

    public StencilException(ErrorKind kind, String message, Integer position, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /// Returns the character offset the failure refers to.
    ///
    /// @return offset in the template text, or null when unknown
    public Integer getPosition() {
        return position;
    }

    /// Converts this failure into a diagnostic record.
    ///
    /// @param contentUnitId unit being processed, may be null
    /// @param severity severity to record, not null
    /// @return the record, never null
    public ErrorRecord toRecord(String contentUnitId, Severity severity) {
        return new ErrorRecord(kind, getMessage(), contentUnitId, position, severity);
    }
}
