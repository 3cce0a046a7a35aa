package com.openforge.memorylane.memory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for an extraction run. Checked between chunks only;
 * a chunk that has started always finishes.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

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
