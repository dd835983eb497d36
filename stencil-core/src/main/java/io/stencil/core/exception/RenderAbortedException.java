package io.stencil.core.exception;

import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.pipeline.RenderReport;
import java.io.Serial;

/// Raised when a strict-mode failure aborts a whole render invocation.
///
/// The partial {@link RenderReport} is attached: units that completed before the abort keep
/// their rendered text, and the error list contains every record collected up to that point,
/// including the fatal one that caused the abort.
public class RenderAbortedException extends StencilException {
    @Serial private static final long serialVersionUID = -4497046113328102739L;

    private final transient RenderReport report;
    private final transient ErrorRecord fatalRecord;

    public RenderAbortedException(ErrorRecord fatalRecord, RenderReport report) {
        super(
                fatalRecord.kind(),
                "Render aborted in unit "
                        + fatalRecord.contentUnitId()
                        + ": "
                        + fatalRecord.message(),
                fatalRecord.position());
        this.fatalRecord = fatalRecord;
        this.report = report;
    }

    /// Returns the report of everything processed before the abort.
    ///
    /// @return partial report, never null
    public RenderReport getReport() {
        return report;
    }

    /// Returns the fatal record that triggered the abort.
    ///
    /// @return the record, never null
    public ErrorRecord getFatalRecord() {
        return fatalRecord;
    }

    @Override
    public ErrorKind getKind() {
        return fatalRecord.kind();
    }
}
