package io.stencil.core.pipeline;

import io.stencil.core.asset.AssetIdAllocator;
import io.stencil.core.asset.AssetSink;
import io.stencil.core.context.ContextValue;
import io.stencil.core.error.ErrorCollector;
import io.stencil.core.error.ErrorRecord;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/// State shared by all content units of one render invocation.
///
/// @implNote Thread-safe. Read by every worker; the abort record is set at most once.
final class RenderInvocation {

    private final ContextValue context;
    private final ErrorCollector errors = new ErrorCollector();
    private final AssetIdAllocator assetIds = new AssetIdAllocator();
    private final AssetSink assets;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<ErrorRecord> abort = new AtomicReference<>();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();
    private final Set<String> abortedUnits = ConcurrentHashMap.newKeySet();

    RenderInvocation(ContextValue context, AssetSink assets) {
        this.context = context;
        this.assets = assets;
    }

    ContextValue context() {
        return context;
    }

    ErrorCollector errors() {
        return errors;
    }

    AssetIdAllocator assetIds() {
        return assetIds;
    }

    AssetSink assets() {
        return assets;
    }

    void track(Future<?> task) {
        tasks.add(task);
        if (cancelled.get()) {
            task.cancel(true);
        }
    }

    /// Stops every unit that is still pending or running.
    void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Future<?> task : tasks) {
                task.cancel(true);
            }
        }
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /// Marks the invocation as aborted by a fatal record and cancels the remaining units.
    /// Only the first abort is kept.
    void abort(ErrorRecord record) {
        if (abort.compareAndSet(null, record)) {
            cancel();
        }
    }

    ErrorRecord abortRecord() {
        return abort.get();
    }

    void markAborted(String unitId) {
        abortedUnits.add(unitId);
    }

    /// Returns whether the unit stopped on its own fatal error, as opposed to being cancelled.
    boolean isAborted(String unitId) {
        return abortedUnits.contains(unitId);
    }
}
