package com.noi.backend.services.extraction.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation, checked by the engine between attempts.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
