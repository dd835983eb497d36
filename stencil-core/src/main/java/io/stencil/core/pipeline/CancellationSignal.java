package io.stencil.core.pipeline;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Cooperative cancellation flag for a render invocation.
///
/// Cancelling stops units that have not started, interrupts running ones and lets the
/// pipeline return with the units already completed.
///
/// @implNote Thread-safe. Listeners run once, on the thread calling {@link #cancel()}.
public final class CancellationSignal {

    private static final Logger logger = Logger.getLogger(CancellationSignal.class.getName());

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /// A signal that is never cancelled by anyone but the pipeline itself.
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /// Requests cancellation. Calls after the first have no effect.
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.fine("Cancellation requested");
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// Registers a callback run on cancellation, or immediately if already cancelled.
    ///
    /// @param listener the callback, not null
    void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
}
