package org.airspace.dss.domain.common;

import org.airspace.dss.domain.error.OperationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller-owned cancellation flag for store operations.
 *
 * Cancelling runs the currently registered hook (the in-flight JDBC statement
 * registers one) and makes every later check throw {@link OperationCancelledException}.
 * Thread-safe: cancel() is normally called from a different thread than the one
 * running the operation.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<Runnable> onCancel = new AtomicReference<>();

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * Shared signal that can never fire.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationSignal.none() cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            Runnable hook = onCancel.getAndSet(null);
            if (hook != null) {
                hook.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new OperationCancelledException("Operation cancelled by caller");
        }
    }

    /**
     * Register the hook to run on cancellation, replacing any previous one.
     * Runs immediately if the signal already fired.
     */
    public void setOnCancel(Runnable hook) {
        if (!cancellable) {
            return;
        }
        onCancel.set(hook);
        if (cancelled.get()) {
            Runnable pending = onCancel.getAndSet(null);
            if (pending != null) {
                pending.run();
            }
        }
    }

    public void clearOnCancel() {
        if (cancellable) {
            onCancel.set(null);
        }
    }
}
