package com.fleetdiag.core.tool;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handed to a running tool.
 * Tools either poll {@link #isCancelled()} or register a callback that stops
 * their external work immediately.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            callbacks.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Run the callback on cancellation, or right away if already cancelled.
     */
    public void onCancel(Runnable callback) {
        AtomicBoolean ran = new AtomicBoolean(false);
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                callback.run();
            }
        };
        callbacks.add(once);
        if (cancelled.get()) {
            once.run();
        }
    }

    public void throwIfCancelled() throws DiagnosticToolException {
        if (isCancelled()) {
            throw DiagnosticToolException.cancelled("Collection was cancelled");
        }
    }
}
