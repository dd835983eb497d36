package io.stencil.core.error;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/// Accumulates diagnostics for one render invocation.
///
/// Purely additive between {@link #reset()} calls. Content units are rendered concurrently,
/// so records from different units may interleave; records from one unit keep their order.
///
/// @implNote Thread-safe. Backed by a {@link CopyOnWriteArrayList}; {@link #all()} returns an
/// immutable snapshot.
public final class ErrorCollector implements ErrorSink {

    private static final Logger logger = Logger.getLogger(ErrorCollector.class.getName());

    private final List<ErrorRecord> records = new CopyOnWriteArrayList<>();

    /// Clears all collected records.
    public void reset() {
        records.clear();
    }

    @Override
    public void add(ErrorRecord record) {
        records.add(record);
        logger.fine(
                () ->
                        record.severity()
                                + " "
                                + record.kind()
                                + " in unit "
                                + record.contentUnitId()
                                + ": "
                                + record.message());
    }

    /// Returns a snapshot of all records in insertion order.
    ///
    /// @return immutable list, never null (may be empty)
    public List<ErrorRecord> all() {
        return List.copyOf(records);
    }

    /// Returns whether any fatal record has been collected.
    public boolean hasFatal() {
        return records.stream().anyMatch(ErrorRecord::isFatal);
    }

    public int size() {
        return records.size();
    }
}
